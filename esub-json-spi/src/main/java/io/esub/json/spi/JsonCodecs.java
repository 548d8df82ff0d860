package io.esub.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the default {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the first {@link JsonCodecProvider} found on the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) {
                return codec;
            }
        }
        throw new IllegalStateException("no JsonCodecProvider found; add esub-json-jackson to the classpath");
    }
}
