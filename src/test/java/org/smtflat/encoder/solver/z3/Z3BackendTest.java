package org.smtflat.encoder.solver.z3;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.smtflat.encoder.api.EncodingContractException;
import org.smtflat.encoder.api.EncodingErrorCode;
import org.smtflat.encoder.config.SolverOptions;
import org.smtflat.encoder.ir.IrType;
import org.smtflat.encoder.junit.logging.LogWatchExtension;
import org.smtflat.encoder.solver.SmtFunction;
import org.smtflat.encoder.solver.SolverBackend;
import org.smtflat.encoder.solver.SolverBackends;
import org.smtflat.encoder.solver.SolverException;
import org.smtflat.encoder.solver.SolverStatus;
import org.smtflat.encoder.solver.SolverTerm;
import org.smtflat.encoder.sort.Sort;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class Z3BackendTest {

    private static final Sort BOOL = new Sort.BoolSort();
    private static final Sort BV8 = new Sort.BitVectorSort(8, false);

    private SolverBackend backend;

    @BeforeEach
    void setUp() {
        backend = SolverBackends.create(SolverOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void factoryCreatesZ3() {
        assertThat(backend).isInstanceOf(Z3Backend.class);
        assertThat(backend.solverText()).startsWith("Z3 ");
        assertThatThrownBy(() -> SolverBackends.create(new SolverOptions("boolector", "QF_AUFBV", 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Literals are reduced modulo 2^width")
    void literalsWrap() {
        SolverTerm x = backend.mkSymbol("x", BV8);
        SolverTerm minusOne = backend.mkBvInt(BigInteger.valueOf(-1), true, 8);
        backend.assertFormula(backend.mkFuncApp(BOOL, SmtFunction.EQ, List.of(x, minusOne)));

        assertThat(backend.check()).isEqualTo(SolverStatus.SATISFIABLE);
        assertThat(backend.getBv(x)).isEqualTo(BigInteger.valueOf(255));
    }

    @Test
    void booleanEqualityIsEquivalence() {
        SolverTerm a = backend.mkSymbol("a", BOOL);
        SolverTerm b = backend.mkSymbol("b", BOOL);
        backend.assertFormula(backend.mkFuncApp(BOOL, SmtFunction.EQ, List.of(a, b)));
        backend.assertFormula(a);

        assertThat(backend.check()).isEqualTo(SolverStatus.SATISFIABLE);
        assertThat(backend.getBool(b)).isTrue();
    }

    @Test
    void arrayStoreAndSelect() {
        Sort arraySort = new Sort.ArraySort(3, BV8);
        SolverTerm arr = backend.mkSymbol("arr", arraySort);
        SolverTerm i = backend.mkBvInt(BigInteger.valueOf(5), false, 3);
        SolverTerm stored = backend.mkFuncApp(arraySort, SmtFunction.STORE,
                List.of(arr, i, backend.mkBvInt(BigInteger.TEN, false, 8)));
        SolverTerm read = backend.mkFuncApp(BV8, SmtFunction.SELECT, List.of(stored, i));

        assertThat(backend.check()).isEqualTo(SolverStatus.SATISFIABLE);
        assertThat(backend.getBv(read)).isEqualTo(BigInteger.TEN);
    }

    @Test
    void wrongArityIsContractFault() {
        SolverTerm a = backend.mkSymbol("a", BOOL);

        assertThatThrownBy(() -> backend.mkFuncApp(BOOL, SmtFunction.ITE, List.of(a, a)))
                .isInstanceOf(EncodingContractException.class)
                .extracting(e -> ((EncodingContractException) e).code())
                .isEqualTo(EncodingErrorCode.SORT_MISMATCH);
    }

    @Test
    void nonBooleanAssertionIsContractFault() {
        SolverTerm x = backend.mkSymbol("x", BV8);

        assertThatThrownBy(() -> backend.assertFormula(x))
                .isInstanceOf(EncodingContractException.class)
                .extracting(e -> ((EncodingContractException) e).code())
                .isEqualTo(EncodingErrorCode.NON_BOOLEAN_ASSERTION);
    }

    @Test
    void tupleSortsNeverReachTheSolver() {
        Sort tuple = new Sort.TupleSort(new IrType.PointerType("int"));

        assertThatThrownBy(() -> backend.mkSymbol("t", tuple))
                .isInstanceOf(EncodingContractException.class);
    }

    @Test
    void modelIsUnavailableAfterUnsat() {
        SolverTerm a = backend.mkSymbol("a", BOOL);
        backend.assertFormula(a);
        backend.assertFormula(backend.mkFuncApp(BOOL, SmtFunction.NOT, List.of(a)));

        assertThat(backend.check()).isEqualTo(SolverStatus.UNSATISFIABLE);
        assertThatThrownBy(() -> backend.getBool(a)).isInstanceOf(SolverException.class);
    }
}
