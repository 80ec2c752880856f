package de.jwiegmann.ultraupload.client;

import de.jwiegmann.ultraupload.client.transport.DefaultUploadStrategy;
import de.jwiegmann.ultraupload.client.transport.EppUploadStrategy;
import de.jwiegmann.ultraupload.client.transport.UploadTypeStrategy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UploadTypeRegistryTest {

    private final UploadTypeRegistry registry = new UploadTypeRegistry(
            Map.of("egi", "/uploading/egi", "epp", "/uploading/epp"), "egi");

    @Test
    void known_type_resolves_to_its_path() {
        UploadRoute route = registry.resolve("egi");

        assertThat(route.getUploadType()).isEqualTo("egi");
        assertThat(route.getPath()).isEqualTo("/uploading/egi");
        assertThat(route.getStrategy()).isInstanceOf(DefaultUploadStrategy.class);
    }

    @Test
    void epp_uses_its_verifying_strategy() {
        assertThat(registry.resolve("epp").getStrategy()).isInstanceOf(EppUploadStrategy.class);
    }

    @Test
    void unknown_type_falls_back_to_default_type() {
        UploadRoute route = registry.resolve("unknown");

        assertThat(route.getUploadType()).isEqualTo("egi");
        assertThat(route.getPath()).isEqualTo("/uploading/egi");
    }

    @Test
    void unknown_type_without_default_path_uses_generic_endpoint() {
        UploadRoute route = new UploadTypeRegistry(Map.of(), null).resolve(null);

        assertThat(route.getUploadType()).isEqualTo("default");
        assertThat(route.getPath()).isEqualTo(UploadTypeRegistry.DEFAULT_PATH);
    }

    @Test
    void registered_strategy_is_used_for_its_type() {
        UploadTypeStrategy custom = (transport, endpoint, payload, cancellation) -> null;
        registry.register("egi", custom);

        assertThat(registry.resolve("egi").getStrategy()).isSameAs(custom);
    }
}
