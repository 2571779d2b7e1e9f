package org.sdbm.expressions.dbm;

import org.junit.jupiter.api.*;
import org.sdbm.expressions.sdbm.SDBMContext;
import org.sdbm.expressions.sdbm.SDBMDiffExpr;
import org.sdbm.expressions.sdbm.SDBMExpr;
import org.sdbm.expressions.sdbm.SDBMStripeExpr;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SDBMTest {

    private SDBMContext context;

    @BeforeEach
    void setUp() {
        context = new SDBMContext();
    }

    @Nested
    @DisplayName("往返稳定性 (Round trip)")
    class RoundTripTests {

        @Test
        @DisplayName("嵌套条带的等式经过两轮构建与提取后保持不变")
        void testRoundTripEqs() {
            SDBMExpr stripe = context.symbol(0).stripe(3).stripe(5);
            SDBMExpr eq0 = stripe.subtract(context.dim(0));
            SDBMExpr eq1 = stripe.subtract(context.dim(1)).add(42);

            SDBMExpressions first = SDBM.get(List.of(), List.of(eq0, eq1)).getSDBMExpressions(context);
            assertTrue(first.getInequalities().isEmpty());
            assertEquals(2, first.getEqualities().size());

            SDBMExpressions second = SDBM.get(first.getInequalities(), first.getEqualities())
                    .getSDBMExpressions(context);
            assertTrue(second.getInequalities().isEmpty());
            assertEquals(new HashSet<>(first.getEqualities()), new HashSet<>(second.getEqualities()));

            SDBMExpressions third = SDBM.get(second.getInequalities(), second.getEqualities())
                    .getSDBMExpressions(context);
            assertEquals(second, third);
        }

        @Test
        @DisplayName("提取出的等式是差分形式")
        void testExtractedEqualityShape() {
            SDBMExpr stripe = context.symbol(0).stripe(3).stripe(5);
            SDBMExpressions extracted = SDBM.get(List.of(),
                    List.of(stripe.subtract(context.dim(0)), stripe.subtract(context.dim(1)).add(42)))
                    .getSDBMExpressions(context);
            assertEquals(List.of(
                    context.dim(0).subtract(stripe),
                    context.dim(1).subtract(stripe).add(-42)), extracted.getEqualities());
        }

        @Test
        @DisplayName("混合约束的往返")
        void testRoundTripMixed() {
            List<SDBMExpr> inequalities = List.of(
                    context.dim(0).subtract(context.symbol(0)).add(-1),
                    context.dim(1).negate().add(4),
                    context.dim(1).subtract(context.symbol(1).stripe(8)));
            List<SDBMExpr> equalities = List.of(context.dim(2).subtract(context.dim(0)).add(3));

            SDBM sdbm = SDBM.get(inequalities, equalities);
            SDBMExpressions first = sdbm.getSDBMExpressions(context);
            SDBM rebuilt = SDBM.get(first.getInequalities(), first.getEqualities());
            assertEquals(sdbm, rebuilt);
            assertEquals(first, rebuilt.getSDBMExpressions(context));
        }
    }

    @Nested
    @DisplayName("构建 (Assembly)")
    class AssemblyTests {

        @Test
        @DisplayName("位置顺序：零、维度、符号、条带临时变量")
        void testPositionLayout() {
            SDBMStripeExpr stripe = context.symbol(1).stripe(4);
            SDBM sdbm = SDBM.get(List.of(context.dim(2).subtract(stripe)), List.of());
            assertAll(
                    () -> assertEquals(4, sdbm.getNumVariables()),
                    () -> assertEquals(1, sdbm.getNumDims()),
                    () -> assertEquals(1, sdbm.getNumSymbols()),
                    () -> assertSame(context.dim(2), sdbm.getPositionTerm(1)),
                    () -> assertSame(context.symbol(1), sdbm.getPositionTerm(2)),
                    () -> assertSame(stripe, sdbm.getPositionTerm(3)),
                    () -> assertFalse(sdbm.isAuxiliary(2)),
                    () -> assertTrue(sdbm.isAuxiliary(3)),
                    () -> assertSame(stripe, sdbm.getStripeDefinitions().get(3))
            );
        }

        @Test
        @DisplayName("条带临时变量由两个界定义")
        void testStripeDefinitionBounds() {
            SDBMStripeExpr stripe = context.dim(0).stripe(4);
            SDBM sdbm = SDBM.get(List.of(context.dim(0).subtract(stripe).add(-2)), List.of());
            // d0 = 1, t = 2
            assertEquals(OptionalLong.of(0), sdbm.getBound(2, 1));
            assertEquals(OptionalLong.of(2), sdbm.getBound(1, 2));
            assertEquals(OptionalLong.empty(), sdbm.getBound(0, 1));
        }

        @Test
        @DisplayName("同一元素上最紧的界胜出，与插入顺序无关")
        void testTightestBoundWins() {
            SDBMExpr loose = context.dim(0).add(-5);
            SDBMExpr tight = context.dim(0).add(-3);
            SDBM forward = SDBM.get(List.of(loose, tight), List.of());
            SDBM backward = SDBM.get(List.of(tight, loose), List.of());
            assertEquals(forward, backward);
            assertEquals(OptionalLong.of(3), forward.getBound(1, 0));
            assertEquals(List.of(context.dim(0).add(-3)), forward.getSDBMExpressions(context).getInequalities());
        }

        @Test
        @DisplayName("等式收紧两个方向")
        void testEqualityTightensBothDirections() {
            SDBM sdbm = SDBM.get(
                    List.of(context.dim(0).subtract(context.dim(1)).add(-10)),
                    List.of(context.dim(0).subtract(context.dim(1)).add(-2)));
            assertEquals(OptionalLong.of(2), sdbm.getBound(1, 2));
            assertEquals(OptionalLong.of(-2), sdbm.getBound(2, 1));
        }

        @Test
        @DisplayName("不是差分约束的表达式被拒绝")
        void testRejectsNonDifference() {
            SDBMExpr sumOfTwo = SDBMDiffExpr.of(context.dim(0), context.symbol(0).negate());
            assertThrows(IllegalArgumentException.class, () -> SDBM.get(List.of(sumOfTwo), List.of()));
            SDBMExpr nestedDiff = context.dim(0).subtract(context.dim(1)).subtract(context.symbol(0));
            assertThrows(IllegalArgumentException.class, () -> SDBM.get(List.of(), List.of(nestedDiff)));
        }

        @Test
        void testRejectsMixedContexts() {
            SDBMContext other = new SDBMContext();
            assertThrows(IllegalArgumentException.class,
                    () -> SDBM.get(List.of(context.dim(0)), List.of(other.dim(0))));
        }

        @Test
        void testOutOfRangePositions() {
            SDBM sdbm = SDBM.get(List.of(context.dim(0)), List.of());
            assertThrows(IndexOutOfBoundsException.class, () -> sdbm.getBound(0, 2));
            assertThrows(IndexOutOfBoundsException.class, () -> sdbm.getPositionTerm(0));
            assertThrows(IndexOutOfBoundsException.class, () -> sdbm.getPositionTerm(2));
        }
    }

    @Nested
    @DisplayName("提取 (Extraction)")
    class ExtractionTests {

        @Test
        @DisplayName("一对互为相反数的不等式合并为等式")
        void testInequalityPairBecomesEquality() {
            SDBMExpr upper = context.dim(0).subtract(context.symbol(0)).add(-3);
            SDBMExpr lower = context.symbol(0).subtract(context.dim(0)).add(3);
            SDBMExpressions extracted = SDBM.get(List.of(upper, lower), List.of()).getSDBMExpressions(context);
            assertTrue(extracted.getInequalities().isEmpty());
            assertEquals(List.of(upper), extracted.getEqualities());
        }

        @Test
        @DisplayName("单变量的上下界")
        void testSingleVariableBounds() {
            SDBMExpr lower = context.dim(0).negate().add(2);
            SDBMExpr upper = context.dim(0).add(-9);
            SDBMExpressions extracted = SDBM.get(List.of(upper, lower), List.of()).getSDBMExpressions(context);
            assertEquals(List.of(lower, upper), extracted.getInequalities());
            assertTrue(extracted.getEqualities().isEmpty());
        }

        @Test
        @DisplayName("条带定义本身蕴含的界不出现在结果中")
        void testStripeDefinitionsAreHidden() {
            SDBMStripeExpr stripe = context.symbol(0).stripe(4);
            SDBMExpr inequality = context.dim(0).subtract(stripe);
            SDBMExpressions extracted = SDBM.get(List.of(inequality), List.of()).getSDBMExpressions(context);
            assertEquals(List.of(inequality), extracted.getInequalities());
            assertTrue(extracted.getEqualities().isEmpty());
        }

        @Test
        @DisplayName("比条带定义更紧的界仍然保留")
        void testTightenedStripeBoundIsKept() {
            SDBMStripeExpr stripe = context.symbol(0).stripe(4);
            SDBMExpr inequality = stripe.subtract(context.symbol(0)).add(1);
            SDBMExpressions extracted = SDBM.get(List.of(inequality), List.of()).getSDBMExpressions(context);
            assertEquals(List.of(inequality), extracted.getInequalities());
        }

        @Test
        @DisplayName("恒假的约束系统提取为单个常数不等式")
        void testInfeasibleConstant() {
            SDBM sdbm = SDBM.get(List.of(context.constant(5), context.dim(0)), List.of());
            assertTrue(sdbm.isTriviallyInfeasible());
            SDBMExpressions extracted = sdbm.getSDBMExpressions(context);
            assertEquals(List.of(context.constant(5)), extracted.getInequalities());
            assertTrue(extracted.getEqualities().isEmpty());

            SDBM fromEquality = SDBM.get(List.of(), List.of(context.constant(-3)));
            assertTrue(fromEquality.isTriviallyInfeasible());
            assertEquals(List.of(context.constant(3)), fromEquality.getSDBMExpressions(context).getInequalities());
        }

        @Test
        @DisplayName("恒真的常数约束被丢弃")
        void testTriviallyTrueConstant() {
            SDBM sdbm = SDBM.get(List.of(context.constant(-1)), List.of(context.constant(0)));
            assertFalse(sdbm.isTriviallyInfeasible());
            assertEquals(1, sdbm.getNumVariables());
            SDBMExpressions extracted = sdbm.getSDBMExpressions(context);
            assertTrue(extracted.getInequalities().isEmpty());
            assertTrue(extracted.getEqualities().isEmpty());
            assertEquals("TRUE", extracted.toString());
        }

        @Test
        void testRequiresOwningContext() {
            SDBM sdbm = SDBM.get(List.of(context.dim(0)), List.of());
            assertThrows(IllegalArgumentException.class, () -> sdbm.getSDBMExpressions(new SDBMContext()));
        }
    }

    @Test
    void testCachedHashIsNotExposed() {
        assertThrows(NoSuchMethodException.class, () -> SDBM.class.getMethod("getHashCode"));
        SDBM lhs = SDBM.get(List.of(context.dim(0).add(-3)), List.of());
        SDBM rhs = SDBM.get(List.of(context.dim(0).add(-3)), List.of());
        assertEquals(lhs, rhs);
        assertEquals(lhs.hashCode(), rhs.hashCode());
    }

    @Test
    void testToString() {
        SDBMStripeExpr stripe = context.symbol(0).stripe(4);
        String text = SDBM.get(List.of(context.dim(0).subtract(stripe)), List.of()).toString();
        assertTrue(text.contains("t3 = s0 # 4"), text);
        assertTrue(text.contains("∞"), text);
    }
}
