package io.esub.json.jackson;

import io.esub.json.spi.JsonCodec;
import io.esub.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
