package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.jackson.JacksonJsonCodec;
import io.github.clickin.flatquery.json.spi.JsonCodec;
import io.github.clickin.flatquery.json.spi.JsonCodecProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecsTest {

    @Test
    void discoversJacksonProviderFromClassPath() {
        Optional<JsonCodec> codec = JsonCodecs.discover(getClass().getClassLoader());

        assertThat(codec).containsInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void defaultsUseDiscoveredCodecForArrayFields() {
        FlatQuery codec = FlatQuery.defaults();

        assertThat(codec.encode(ArrayShapeTest.Tagged.SHAPE, new ArrayShapeTest.Tagged("a", Array.of("x"), Optional.empty())))
                .isEqualTo("name=a&ids=[\"x\"]");
    }

    @Test
    void arrayFieldsFailWithoutAnyCodec() {
        ClassLoader empty = new URLClassLoader(new URL[0], null);
        Optional<JsonCodec> none = JsonCodecs.discover(empty);

        assertThat(none).isEmpty();

        ClassLoader previous = Thread.currentThread().getContextClassLoader();
        Thread.currentThread().setContextClassLoader(empty);
        FlatQuery codec;
        try {
            codec = FlatQuery.defaults();
        } finally {
            Thread.currentThread().setContextClassLoader(previous);
        }

        assertThat(codec.decode(Fixtures.Person.SHAPE, "name=a&age=1")).isEqualTo(new Fixtures.Person("a", 1));
        assertThatThrownBy(() -> codec.decode(ArrayShapeTest.Tagged.SHAPE, "name=a&ids=[]"))
                .isInstanceOf(FlatQueryException.Unsupported.class)
                .hasMessage("no JSON codec available for array fields");
    }

    @Test
    void providerReturningNoCodecIsIgnored(@TempDir Path dir) throws IOException {
        String resource = "META-INF/services/" + JsonCodecProvider.class.getName();
        Path services = dir.resolve(resource);
        Files.createDirectories(services.getParent());
        Files.writeString(services, NullJsonCodecProvider.class.getName() + "\n", StandardCharsets.UTF_8);
        URL registration = services.toUri().toURL();

        ClassLoader onlyNullProvider = new ClassLoader(getClass().getClassLoader()) {
            @Override
            public Enumeration<URL> getResources(String name) throws IOException {
                if (resource.equals(name)) {
                    return Collections.enumeration(List.of(registration));
                }
                return super.getResources(name);
            }
        };

        assertThat(JsonCodecs.discover(onlyNullProvider)).isEmpty();
    }
}
