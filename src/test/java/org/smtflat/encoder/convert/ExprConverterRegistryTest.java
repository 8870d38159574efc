package org.smtflat.encoder.convert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.api.UnsupportedEncodingException;
import org.smtflat.encoder.convert.converters.IndexConverter;
import org.smtflat.encoder.convert.converters.SymbolConverter;
import org.smtflat.encoder.ir.IrExpr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.smtflat.encoder.testsupport.EncoderFixtures.U8;

@Tag("unit")
class ExprConverterRegistryTest {

    @Test
    @DisplayName("Every IR node type has a built-in converter")
    void defaultsCoverAllNodeTypes() {
        ExprConverterRegistry registry = ExprConverterRegistry.initializeWithDefaults();

        for (Class<?> nodeType : IrExpr.class.getPermittedSubclasses()) {
            assertThat(registry.get(nodeType.asSubclass(IrExpr.class)))
                    .as(nodeType.getSimpleName())
                    .isPresent();
        }
        assertThat(registry.resolve(IrExpr.symbol("x", U8))).isInstanceOf(SymbolConverter.class);
    }

    @Test
    @DisplayName("Unregistered node types fall back to a refusing converter")
    void fallbackRefuses() {
        ExprConverterRegistry registry = ExprConverterRegistry.initialize(new DefaultExprConverter());
        registry.register(IrExpr.Index.class, new IndexConverter());
        IrExpr node = IrExpr.bool(true);

        IExprConverter<IrExpr> converter = registry.resolve(node);

        assertThat(converter).isSameAs(registry.defaultConverter());
        assertThatThrownBy(() -> converter.convert(node, null))
                .isInstanceOf(UnsupportedEncodingException.class)
                .extracting(e -> ((UnsupportedEncodingException) e).code())
                .isEqualTo(EncodingErrorCode.UNSUPPORTED_EXPRESSION);
    }
}
