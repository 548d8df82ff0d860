package io.esub.json.spi;

/**
 * ServiceLoader hook for contributing a {@link JsonCodec}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
