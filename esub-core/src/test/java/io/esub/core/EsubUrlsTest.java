package io.esub.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EsubUrlsTest {

    private static final URI BASE = URI.create("ws://node-1:8090");

    @Test
    void psubOmitsQueryWhenNothingIsSet() {
        URI url = EsubUrls.psub(BASE, new Subscription("orders", null, null, false));
        assertThat(url.toString()).isEqualTo("ws://node-1:8090/psub/orders");
    }

    @Test
    void psubCarriesTokenSharedAndTimeoutSeconds() {
        URI url = EsubUrls.psub(BASE, new Subscription("orders", "t0", Duration.ofSeconds(30), true));
        assertThat(url.toString()).isEqualTo("ws://node-1:8090/psub/orders?shared=1&timeout=30&token=t0");
    }

    @Test
    void prepAddsPsubFlagOnlyWhenRequested() {
        assertThat(EsubUrls.prep(BASE, null, false).toString()).isEqualTo("ws://node-1:8090/prep");
        assertThat(EsubUrls.prep(BASE, "t0", true).toString()).isEqualTo("ws://node-1:8090/prep?psub=1&token=t0");
    }

    @Test
    void repAndSubUseOneShotPaths() {
        URI http = URI.create("http://localhost:8090");
        assertThat(EsubUrls.sub(http, "k", null).toString()).isEqualTo("http://localhost:8090/sub/k");
        assertThat(EsubUrls.rep(http, "k", "t", true).toString()).isEqualTo("http://localhost:8090/rep/k?psub=1&token=t");
        assertThat(EsubUrls.info(http).toString()).isEqualTo("http://localhost:8090/info");
    }

    @Test
    void keysAreEncodedAsPathSegments() {
        URI url = EsubUrls.sub(URI.create("http://localhost:8090/"), "a b/c", null);
        assertThat(url.toString()).isEqualTo("http://localhost:8090/sub/a%20b%2Fc");
    }

    @Test
    void withQuerySkipsEmptyValues() {
        URI url = EsubUrls.withQuery(URI.create("http://h:1/x"), Map.of("token", "", "b", "2"));
        assertThat(url.toString()).isEqualTo("http://h:1/x?b=2");
    }
}
