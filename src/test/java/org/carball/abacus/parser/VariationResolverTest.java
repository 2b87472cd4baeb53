package org.carball.abacus.parser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.abacus.config.VariationFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VariationResolverTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(VariationResolver.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldResolveKeysAndIndicesAlikeWhenKeysAreIndices() {
        List<String> variations = List.of("0", "1", "2");
        VariationResolver byKey = new VariationResolver(VariationFormat.KEY, variations);
        VariationResolver byIndex = new VariationResolver(VariationFormat.INDEX, variations);

        for (String value : variations) {
            assertThat(byKey.resolve(value)).isEqualTo(byIndex.resolve(value));
        }
        assertThat(byKey.resolve("2")).hasValue(2);
    }

    @Test
    void shouldLookUpKeysInDeclarationOrder() {
        VariationResolver resolver = new VariationResolver(VariationFormat.KEY, List.of("control", "blue", "green"));

        assertThat(resolver.resolve("green")).hasValue(2);
        assertThat(resolver.resolve("control")).hasValue(0);
    }

    @Test
    void shouldDropOutOfRangeAndUnknownValuesWithWarning() {
        VariationResolver index = new VariationResolver(VariationFormat.INDEX, List.of("a", "b"));
        VariationResolver key = new VariationResolver(VariationFormat.KEY, List.of("a", "b"));

        assertThat(index.resolve("2")).isEmpty();
        assertThat(index.resolve("-1")).isEmpty();
        assertThat(index.resolve("b")).isEmpty();
        assertThat(key.resolve("c")).isEmpty();
        assertThat(key.resolve(null)).isEmpty();

        assertThat(logAppender.list)
                .hasSize(5)
                .allSatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.WARN);
                    assertThat(e.getFormattedMessage()).startsWith("Unexpected variation");
                });
    }

    @Test
    void shouldAcceptDecimalIndicesFromNumericColumns() {
        VariationResolver resolver = new VariationResolver(VariationFormat.INDEX, List.of("a", "b"));

        assertThat(resolver.resolve("1.0")).hasValue(1);
        assertThat(resolver.resolve(" 0.0 ")).hasValue(0);
        assertThat(resolver.resolve("NaN")).isEmpty();
        assertThat(logAppender.list).hasSize(1);
    }
}
