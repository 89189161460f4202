package com.storescout.scan.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheFlavorTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void cacheKeysPerFlavor() {
        assertThat(new UrlListFlavor(objectMapper).cacheKey("cricket")).isEqualTo("cricket_urls");
        assertThat(new RichUrlListFlavor(objectMapper).cacheKey("cricket")).isEqualTo("cricket_rich_urls");
        assertThat(new ResponseBodyFlavor().cacheKey("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void responseBodyIsStoredVerbatim() {
        ResponseBodyFlavor flavor = new ResponseBodyFlavor();
        String body = "{\"response\":{\"modules\":[]}}";

        assertThat(flavor.deserialize(flavor.serialize(body))).isEqualTo(body);
    }
}
