package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.spi.JsonCodec;
import io.github.clickin.flatquery.json.spi.JsonCodecProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link JsonCodec} lookup backed by {@link java.util.ServiceLoader}.
 *
 * <p>The first registered {@link JsonCodecProvider} wins. Register a codec explicitly with
 * {@link FlatQuery.Builder#jsonCodec(JsonCodec)} when more than one binding is on the class path
 * or when ServiceLoader is not available (native images).
 */
public final class JsonCodecs {
    private static final Logger LOG = LoggerFactory.getLogger(JsonCodecs.class);

    private JsonCodecs() {}

    public static Optional<JsonCodec> discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        List<JsonCodecProvider> providers = new ArrayList<>();
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            providers.add(p);
        }
        if (providers.isEmpty()) {
            LOG.debug("No JsonCodecProvider registered; array fields need an explicit JSON codec");
            return Optional.empty();
        }
        if (providers.size() > 1) {
            LOG.warn("{} JsonCodecProviders registered, using {}", providers.size(), providers.get(0).getClass().getName());
        }
        JsonCodecProvider provider = providers.get(0);
        JsonCodec codec = provider.codec();
        if (codec == null) {
            LOG.warn("JsonCodecProvider {} returned no codec", provider.getClass().getName());
            return Optional.empty();
        }
        LOG.debug("Using JSON codec {} for array fields", codec.getClass().getName());
        return Optional.of(codec);
    }

    public static Optional<JsonCodec> discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return discover(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }
}
