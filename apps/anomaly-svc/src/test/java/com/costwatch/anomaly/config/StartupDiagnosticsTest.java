package com.costwatch.anomaly.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.anomaly.CostFixtures;
import com.costwatch.anomaly.repository.DailyCostRepository;
import com.costwatch.anomaly.repository.InMemoryDailyCostRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(OutputCaptureExtension.class)
class StartupDiagnosticsTest {

    private final CostwatchProperties props = new CostwatchProperties(null, null);

    @Test
    void warnsWhenInMemoryStoreIsEmpty(CapturedOutput output) {
        new StartupDiagnostics(props, new InMemoryDailyCostRepository()).logConfig();

        assertThat(output).contains("Cost store is in-memory and empty");
    }

    @Test
    void quietWhenInMemoryStoreHasRows(CapturedOutput output) {
        InMemoryDailyCostRepository repository = new InMemoryDailyCostRepository();
        repository.saveAll(CostFixtures.rows("AmazonEC2", 1, 2, 3));

        new StartupDiagnostics(props, repository).logConfig();

        assertThat(output).contains("Anomaly config").doesNotContain("Cost store is in-memory and empty");
    }

    @Test
    void quietForJdbcStore(CapturedOutput output) {
        DailyCostRepository repository = mock(DailyCostRepository.class);
        when(repository.storeType()).thenReturn("jdbc");

        new StartupDiagnostics(props, repository).logConfig();

        assertThat(output).doesNotContain("Cost store is in-memory and empty");
    }
}
