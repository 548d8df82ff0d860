package io.esub.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EsubConfigTest {

    @Test
    void emptyEnvironmentYieldsDefaults() {
        EsubConfig config = EsubConfig.fromEnvironment(Map.of());

        assertThat(config.host()).isEqualTo("localhost");
        assertThat(config.port()).isEqualTo(8090);
        assertThat(config.scheme()).isEqualTo("http");
        assertThat(config.duplexScheme()).isEqualTo("ws");
        assertThat(config.token()).isNull();
        assertThat(config.retries()).isZero();
        assertThat(config.confirm()).isFalse();
        assertThat(config.probePeriod()).isEqualTo(Duration.ofSeconds(54));
    }

    @Test
    void readsEveryRecognizedVariable() {
        Map<String, String> env = new HashMap<>();
        env.put("ESUB_SERVICE_HOST", "esub.internal");
        env.put("ESUB_SERVICE_PORT", "9000");
        env.put("ESUB_PROTOCOL", "https");
        env.put("ESUB_WEBSOCKET_PROTOCOL", "wss");
        env.put("ESUB_TOKEN", "secret");
        env.put("ESUB_REQUEST_RETRIES", "3");
        env.put("ESUB_CONFIRM_RECEIPT", "yes");
        env.put("ESUB_PING_FREQUENCY", "20");

        EsubConfig config = EsubConfig.fromEnvironment(env);

        assertThat(config.baseUrl(null).toString()).isEqualTo("https://esub.internal:9000");
        assertThat(config.duplexBaseUrl("10.0.0.7").toString()).isEqualTo("wss://10.0.0.7:9000");
        assertThat(config.token()).isEqualTo("secret");
        assertThat(config.retries()).isEqualTo(3);
        assertThat(config.confirm()).isTrue();
        assertThat(config.probePeriod()).isEqualTo(Duration.ofSeconds(18));
    }

    @Test
    void confirmIsOffForEmptyOrZero() {
        assertThat(EsubConfig.fromEnvironment(Map.of("ESUB_CONFIRM_RECEIPT", "")).confirm()).isFalse();
        assertThat(EsubConfig.fromEnvironment(Map.of("ESUB_CONFIRM_RECEIPT", "0")).confirm()).isFalse();
        assertThat(EsubConfig.fromEnvironment(Map.of("ESUB_CONFIRM_RECEIPT", "1")).confirm()).isTrue();
    }

    @Test
    void emptyRetriesCountAsZero() {
        assertThat(EsubConfig.fromEnvironment(Map.of("ESUB_REQUEST_RETRIES", "")).retries()).isZero();
    }

    @Test
    void rejectsMalformedNumbers() {
        assertThatThrownBy(() -> EsubConfig.fromEnvironment(Map.of("ESUB_SERVICE_PORT", "eighty")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ESUB_SERVICE_PORT");
        assertThatThrownBy(() -> EsubConfig.fromEnvironment(Map.of("ESUB_SERVICE_PORT", "70000")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderRoundTripsOverrides() {
        EsubConfig config = EsubConfig.defaults().toBuilder().confirm(true).port(1234).build();
        assertThat(config.confirm()).isTrue();
        assertThat(config.port()).isEqualTo(1234);
        assertThat(config.host()).isEqualTo("localhost");
    }
}
