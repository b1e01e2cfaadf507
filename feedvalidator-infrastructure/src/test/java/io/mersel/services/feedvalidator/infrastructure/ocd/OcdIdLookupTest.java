package io.mersel.services.feedvalidator.infrastructure.ocd;

import io.mersel.services.feedvalidator.application.interfaces.IOcdIdDatasetProvider;
import io.mersel.services.feedvalidator.application.interfaces.OcdIdDatasetException;
import io.mersel.services.feedvalidator.application.models.OcdIdDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OcdIdLookup")
class OcdIdLookupTest {

    @Mock
    private IOcdIdDatasetProvider provider;

    @Test
    @DisplayName("dataset_memoized - provider asked once")
    void dataset_memoized() throws Exception {
        var dataset = new OcdIdDataset("us", "cache", Map.of("ocd-division/country:us", "United States"));
        when(provider.getDataset("us", null)).thenReturn(dataset);
        var lookup = new OcdIdLookup(provider, " us ", null);

        assertThat(lookup.dataset()).isSameAs(dataset);
        assertThat(lookup.dataset()).isSameAs(dataset);
        verify(provider, times(1)).getDataset("us", null);
    }

    @Test
    @DisplayName("failure_memoized - the same failure is rethrown without a new attempt")
    void failure_memoized() throws Exception {
        Path local = Path.of("missing.csv");
        when(provider.getDataset(null, local)).thenThrow(new OcdIdDatasetException("not found"));
        var lookup = new OcdIdLookup(provider, null, local);

        assertThatThrownBy(lookup::dataset).hasMessage("not found");
        assertThatThrownBy(lookup::dataset).hasMessage("not found");
        verify(provider, times(1)).getDataset(null, local);
    }

    @Test
    @DisplayName("configuration - country or local file required")
    void configuration() {
        assertThat(OcdIdLookup.disabled().isConfigured()).isFalse();
        assertThat(new OcdIdLookup(provider, "  ", null).isConfigured()).isFalse();
        assertThat(new OcdIdLookup(provider, "us", null).isConfigured()).isTrue();
        assertThat(new OcdIdLookup(provider, null, Path.of("ids.csv")).isConfigured()).isTrue();
        assertThatThrownBy(() -> OcdIdLookup.disabled().dataset()).isInstanceOf(OcdIdDatasetException.class);
    }
}
