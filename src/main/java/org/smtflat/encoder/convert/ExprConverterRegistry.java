package org.smtflat.encoder.convert;

import org.smtflat.encoder.convert.converters.AddressOfConverter;
import org.smtflat.encoder.convert.converters.ArrayConstantConverter;
import org.smtflat.encoder.convert.converters.ArrayOfConverter;
import org.smtflat.encoder.convert.converters.BoolConstantConverter;
import org.smtflat.encoder.convert.converters.BoolOpConverter;
import org.smtflat.encoder.convert.converters.BvBinaryConverter;
import org.smtflat.encoder.convert.converters.BvCompareConverter;
import org.smtflat.encoder.convert.converters.ConcatConverter;
import org.smtflat.encoder.convert.converters.EqualityConverter;
import org.smtflat.encoder.convert.converters.ExtractConverter;
import org.smtflat.encoder.convert.converters.IfConverter;
import org.smtflat.encoder.convert.converters.IndexConverter;
import org.smtflat.encoder.convert.converters.IntConstantConverter;
import org.smtflat.encoder.convert.converters.MemberOfConverter;
import org.smtflat.encoder.convert.converters.NotConverter;
import org.smtflat.encoder.convert.converters.NotEqualConverter;
import org.smtflat.encoder.convert.converters.StructConstantConverter;
import org.smtflat.encoder.convert.converters.SymbolConverter;
import org.smtflat.encoder.convert.converters.UnionConstantConverter;
import org.smtflat.encoder.convert.converters.WithConverter;
import org.smtflat.encoder.ir.IrExpr;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping IR node classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The
 * {@link #resolve(IrExpr)} method walks the class hierarchy to find the
 * nearest registered converter.
 */
public final class ExprConverterRegistry {

    private final Map<Class<? extends IrExpr>, IExprConverter<? extends IrExpr>> byClass = new HashMap<>();
    private final IExprConverter<IrExpr> defaultConverter;

    private ExprConverterRegistry(IExprConverter<IrExpr> defaultConverter) {
        this.defaultConverter = defaultConverter;
    }

    /**
     * Registers a converter for the given IR node class.
     *
     * @param nodeType  The concrete IR node class.
     * @param converter The converter instance handling that class.
     * @param <T>       Concrete node type parameter.
     */
    public <T extends IrExpr> void register(Class<T> nodeType, IExprConverter<T> converter) {
        byClass.put(nodeType, converter);
    }

    /**
     * Retrieves the converter strictly registered for the given class (no hierarchy search).
     *
     * @param nodeType The IR node class to look up.
     * @return Optional converter if present.
     */
    public Optional<IExprConverter<? extends IrExpr>> get(Class<? extends IrExpr> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * Resolves a converter for the given node by searching the node's concrete class,
     * then its interfaces and superclasses. Falls back to the default converter.
     *
     * @param node The IR node to resolve a converter for.
     * @return A non-null converter to handle the node.
     */
    @SuppressWarnings("unchecked")
    public IExprConverter<IrExpr> resolve(IrExpr node) {
        Class<?> c = node.getClass();
        while (c != null && IrExpr.class.isAssignableFrom(c)) {
            IExprConverter<?> found = byClass.get(c);
            if (found != null) return (IExprConverter<IrExpr>) found;
            for (Class<?> i : c.getInterfaces()) {
                if (IrExpr.class.isAssignableFrom(i)) {
                    found = byClass.get(i.asSubclass(IrExpr.class));
                    if (found != null) return (IExprConverter<IrExpr>) found;
                }
            }
            c = c.getSuperclass();
        }
        return defaultConverter;
    }

    /**
     * @return The fallback converter used when no specific converter is registered.
     */
    public IExprConverter<IrExpr> defaultConverter() {
        return defaultConverter;
    }

    /**
     * Creates an empty registry with the given default converter.
     *
     * @param defaultConverter The fallback converter for unknown node types.
     * @return A new registry instance.
     */
    public static ExprConverterRegistry initialize(IExprConverter<IrExpr> defaultConverter) {
        return new ExprConverterRegistry(defaultConverter);
    }

    /**
     * Initializes a registry with the default converter and registers all built-in converters.
     *
     * @return A registry pre-populated with the standard converters.
     */
    public static ExprConverterRegistry initializeWithDefaults() {
        ExprConverterRegistry reg = initialize(new DefaultExprConverter());
        reg.register(IrExpr.Symbol.class, new SymbolConverter());
        reg.register(IrExpr.IntConstant.class, new IntConstantConverter());
        reg.register(IrExpr.BoolConstant.class, new BoolConstantConverter());
        reg.register(IrExpr.StructConstant.class, new StructConstantConverter());
        reg.register(IrExpr.UnionConstant.class, new UnionConstantConverter());
        reg.register(IrExpr.ArrayConstant.class, new ArrayConstantConverter());
        reg.register(IrExpr.ArrayOf.class, new ArrayOfConverter());
        reg.register(IrExpr.MemberOf.class, new MemberOfConverter());
        reg.register(IrExpr.With.class, new WithConverter());
        reg.register(IrExpr.Index.class, new IndexConverter());
        reg.register(IrExpr.If.class, new IfConverter());
        reg.register(IrExpr.Equality.class, new EqualityConverter());
        reg.register(IrExpr.NotEqual.class, new NotEqualConverter());
        reg.register(IrExpr.Not.class, new NotConverter());
        reg.register(IrExpr.BoolOp.class, new BoolOpConverter());
        reg.register(IrExpr.BvBinary.class, new BvBinaryConverter());
        reg.register(IrExpr.BvCompare.class, new BvCompareConverter());
        reg.register(IrExpr.Extract.class, new ExtractConverter());
        reg.register(IrExpr.Concat.class, new ConcatConverter());
        reg.register(IrExpr.AddressOf.class, new AddressOfConverter());
        return reg;
    }
}
