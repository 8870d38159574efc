package org.smtflat.encoder.pointer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.smtflat.encoder.SmtConverter;
import org.smtflat.encoder.api.ConversionResult;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.ast.TupleAst;
import org.smtflat.encoder.ir.IrExpr;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.ir.IrValue;
import org.smtflat.encoder.junit.logging.ExpectLog;
import org.smtflat.encoder.junit.logging.LogLevel;
import org.smtflat.encoder.junit.logging.LogWatchExtension;
import org.smtflat.encoder.solver.SolverStatus;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smtflat.encoder.ir.IrExpr.bv;
import static org.smtflat.encoder.ir.IrExpr.index;
import static org.smtflat.encoder.ir.IrExpr.struct;
import static org.smtflat.encoder.ir.IrExpr.symbol;
import static org.smtflat.encoder.testsupport.EncoderFixtures.INT_PTR;
import static org.smtflat.encoder.testsupport.EncoderFixtures.newConverter;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class PointerEncodingTest {

    private SmtConverter converter;
    private PointerTable table;

    @BeforeEach
    void setUp() {
        converter = newConverter();
        table = converter.session().pointerTable();
    }

    @AfterEach
    void tearDown() {
        converter.close();
    }

    @Test
    @DisplayName("{object_id=1, offset=4} reads back as the registered object at offset 4")
    void literalPointerResolvesThroughTable() {
        PointerObject heap = table.register("heap_block");
        IrExpr pointer = struct(INT_PTR, bv(1, 64), bv(4, 64));
        TupleAst ast = (TupleAst) converter.convert(pointer);

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        IrValue.Pointer read = (IrValue.Pointer) converter.readback(ast);
        assertThat(read.object()).isEqualTo(heap);
        assertThat(read.offset()).isEqualTo(BigInteger.valueOf(4));
    }

    @Test
    void nullSymbolIsObjectZero() {
        IrExpr.Symbol p = symbol("p", INT_PTR);
        converter.assign(p, IrExpr.nullPointer(INT_PTR));

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        assertThat(converter.readback(p)).isEqualTo(new IrValue.Pointer(table.nullObject(), BigInteger.ZERO));
        assertThat(converter.readback(symbol(IrExpr.ZERO_NAME, INT_PTR)))
                .isEqualTo(new IrValue.Pointer(table.nullObject(), BigInteger.ZERO));
    }

    @Test
    void addressOfRegistersObject() {
        IrExpr.Symbol p = symbol("p", INT_PTR);
        converter.assign(p, new IrExpr.AddressOf("counter", INT_PTR));

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        IrValue.Pointer read = (IrValue.Pointer) converter.readback(p);
        assertThat(read.object().name()).isEqualTo("counter");
        assertThat(table.lookup("counter")).contains(read.object());
    }

    @Test
    void invalidSymbolUsesInvalidObject() {
        TupleAst invalid = (TupleAst) converter.convert(symbol(IrExpr.INVALID_NAME, INT_PTR));

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        IrValue read = converter.readback(invalid);

        assertThat(((IrValue.Pointer) read).object()).isEqualTo(table.invalidObject());
    }

    @Test
    void unregisteredIdentifiersAreReported() {
        IrExpr.Symbol p = symbol("p", INT_PTR);
        converter.assertTrue(IrExpr.eq(IrExpr.member(p, 0), bv(77, 64)));

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        IrValue.Pointer read = (IrValue.Pointer) converter.readback(p);
        assertThat(read.object().isRegistered()).isFalse();
        assertThat(read.object().id()).isEqualTo(77);
    }

    @Test
    @DisplayName("Arrays of pointers broadcast from NULL hold NULL everywhere")
    void nullPointerBroadcast() {
        IrType.ArrayType type = IrType.array(INT_PTR, 4);
        IrExpr nulls = new IrExpr.ArrayOf(type, IrExpr.nullPointer(INT_PTR));
        TupleAst last = (TupleAst) converter.convert(index(nulls, bv(3, 8)));

        assertThat(converter.check()).isEqualTo(SolverStatus.SATISFIABLE);

        assertThat(converter.readback(last))
                .isEqualTo(new IrValue.Pointer(table.nullObject(), BigInteger.ZERO));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*SmtConverter", messagePattern = "Refused.*")
    void otherPointerBroadcastsAreRefused() {
        IrType.ArrayType type = IrType.array(INT_PTR, 4);
        IrExpr arrayOf = new IrExpr.ArrayOf(type, new IrExpr.AddressOf("x", INT_PTR));

        ConversionResult result = converter.tryConvert(arrayOf);

        assertThat(result).isInstanceOf(ConversionResult.Refused.class);
        assertThat(((ConversionResult.Refused) result).code()).isEqualTo(EncodingErrorCode.POINTER_ARRAY_INITIALIZER);
    }
}
