package org.sdbm.expressions.sdbm;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SDBMExprTest {

    private SDBMContext context;

    @BeforeEach
    void setUp() {
        context = new SDBMContext();
    }

    @Nested
    @DisplayName("唯一化 (Uniquing)")
    class UniquingTests {

        @Test
        @DisplayName("相同字段的表达式是同一个实例")
        void testSameFieldsSameInstance() {
            assertAll(
                    () -> assertSame(context.constant(42), context.constant(42)),
                    () -> assertSame(context.dim(0), context.dim(0)),
                    () -> assertSame(context.symbol(3), context.symbol(3)),
                    () -> assertSame(context.dim(0).stripe(3), context.dim(0).stripe(context.constant(3))),
                    () -> assertSame(SDBMNegExpr.of(context.dim(1)), SDBMNegExpr.of(context.dim(1))),
                    () -> assertSame(SDBMSumExpr.of(context.dim(0), context.constant(5)),
                            SDBMSumExpr.of(context.dim(0), context.constant(5))),
                    () -> assertSame(SDBMDiffExpr.of(context.dim(0), context.symbol(0)),
                            SDBMDiffExpr.of(context.dim(0), context.symbol(0)))
            );
        }

        @Test
        @DisplayName("字段不同的表达式是不同的实例")
        void testDifferentFieldsDifferentInstances() {
            assertAll(
                    () -> assertNotSame(context.constant(1), context.constant(2)),
                    () -> assertNotSame(context.dim(0), context.dim(1)),
                    () -> assertNotEquals(context.dim(0), context.symbol(0)),
                    () -> assertNotSame(context.dim(0).stripe(3), context.dim(0).stripe(4)),
                    () -> assertNotSame(SDBMDiffExpr.of(context.dim(0), context.dim(1)),
                            SDBMDiffExpr.of(context.dim(1), context.dim(0)))
            );
        }

        @Test
        @DisplayName("不同上下文中的表达式互不相等")
        void testDistinctContexts() {
            SDBMContext other = new SDBMContext();
            assertNotEquals(context.dim(0), other.dim(0));
            assertNotSame(context.constant(7), other.constant(7));
        }

        @Test
        @DisplayName("重复请求不会增加唯一化表的大小")
        void testNoDuplicateEntries() {
            context.dim(0).stripe(3);
            int size = context.size();
            context.dim(0).stripe(3);
            context.dim(0);
            context.constant(3);
            assertEquals(size, context.size());
        }

        @Test
        @DisplayName("并发请求得到同一个实例")
        void testConcurrentUniquing() throws InterruptedException {
            List<SDBMExpr> results = Collections.synchronizedList(new ArrayList<>());
            List<Thread> threads = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                Thread thread = new Thread(() -> results.add(context.symbol(2).stripe(16)));
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }
            assertEquals(8, results.size());
            results.forEach(expr -> assertSame(results.get(0), expr));
        }
    }

    @Nested
    @DisplayName("变体与能力类 (Variants and capability classes)")
    class HierarchyTests {

        @Test
        void testConstant() {
            SDBMConstantExpr constant = context.constant(-3);
            assertAll(
                    () -> assertEquals(SDBMExprKind.CONSTANT, constant.getKind()),
                    () -> assertEquals(-3, constant.getValue()),
                    () -> assertFalse(constant.isVarying()),
                    () -> assertFalse(constant.isPositive()),
                    () -> assertFalse(constant.isInput()),
                    () -> assertSame(context, constant.getContext()),
                    () -> assertEquals("-3", constant.toString())
            );
        }

        @Test
        void testDimAndSymbol() {
            SDBMDimExpr dim = context.dim(1);
            SDBMSymbolExpr symbol = context.symbol(2);
            assertAll(
                    () -> assertEquals(1, dim.getPosition()),
                    () -> assertEquals(2, symbol.getPosition()),
                    () -> assertTrue(dim.isInput() && dim.isPositive() && dim.isVarying()),
                    () -> assertTrue(symbol.isInput() && symbol.isPositive() && symbol.isVarying()),
                    () -> assertTrue(dim.as(SDBMInputExpr.class).isPresent()),
                    () -> assertTrue(symbol.isa(SDBMInputExpr.class)),
                    () -> assertFalse(dim.as(SDBMSymbolExpr.class).isPresent()),
                    () -> assertEquals("d1", dim.toString()),
                    () -> assertEquals("s2", symbol.toString())
            );
        }

        @Test
        void testNegativePositionRejected() {
            assertThrows(IllegalArgumentException.class, () -> context.dim(-1));
            assertThrows(IllegalArgumentException.class, () -> context.symbol(-1));
        }

        @Test
        void testStripe() {
            SDBMStripeExpr stripe = context.dim(0).stripe(3);
            assertAll(
                    () -> assertSame(context.dim(0), stripe.getVar()),
                    () -> assertSame(context.constant(3), stripe.getStripeFactor()),
                    () -> assertTrue(stripe.isPositive()),
                    () -> assertTrue(stripe.isVarying()),
                    () -> assertFalse(stripe.isInput()),
                    () -> assertFalse(stripe.as(SDBMInputExpr.class).isPresent()),
                    () -> assertEquals("d0 # 3", stripe.toString())
            );
        }

        @Test
        @DisplayName("嵌套条带不会被合并")
        void testNestedStripe() {
            SDBMStripeExpr inner = context.symbol(0).stripe(3);
            SDBMStripeExpr outer = inner.stripe(5);
            assertSame(inner, outer.getVar());
            assertEquals(5, outer.getStripeFactor().getValue());
            assertEquals("s0 # 3 # 5", outer.toString());
        }

        @Test
        @DisplayName("非正的条带因子被拒绝")
        void testNonPositiveStripeFactor() {
            IllegalArgumentException zero = assertThrows(IllegalArgumentException.class,
                    () -> context.dim(0).stripe(0));
            assertTrue(zero.getMessage().contains("non-positive"));
            assertThrows(IllegalArgumentException.class, () -> context.dim(0).stripe(-2));
        }

        @Test
        @DisplayName("只能对 Positive 表达式做条带")
        void testStripeOfNonPositive() {
            assertThrows(IllegalArgumentException.class,
                    () -> SDBMStripeExpr.of(context.constant(4), context.constant(2)));
            assertThrows(IllegalArgumentException.class,
                    () -> SDBMStripeExpr.of(context.dim(0).negate(), context.constant(2)));
        }

        @Test
        void testNegSumDiff() {
            SDBMNegExpr neg = SDBMNegExpr.of(context.dim(0));
            SDBMSumExpr sum = SDBMSumExpr.of(context.dim(0), context.constant(-4));
            SDBMDiffExpr diff = SDBMDiffExpr.of(context.dim(0), context.symbol(1));
            assertAll(
                    () -> assertEquals(SDBMExprKind.NEG, neg.getKind()),
                    () -> assertTrue(neg.isVarying()),
                    () -> assertFalse(neg.isPositive()),
                    () -> assertEquals("-d0", neg.toString()),
                    () -> assertEquals(SDBMExprKind.SUM, sum.getKind()),
                    () -> assertEquals(-4, sum.getRhs().getValue()),
                    () -> assertEquals("d0 - 4", sum.toString()),
                    () -> assertEquals(SDBMExprKind.DIFF, diff.getKind()),
                    () -> assertSame(context.symbol(1), diff.getRhs()),
                    () -> assertFalse(diff.isPositive()),
                    () -> assertEquals("d0 - s1", diff.toString())
            );
        }

        @Test
        @DisplayName("最小的 long 常数也能正确打印")
        void testSumWithMinValue() {
            SDBMSumExpr sum = SDBMSumExpr.of(context.dim(0), context.constant(Long.MIN_VALUE));
            assertEquals("d0 - 9223372036854775808", sum.toString());
            assertEquals("d0 + 9223372036854775807", SDBMSumExpr.of(context.dim(0), context.constant(Long.MAX_VALUE)).toString());
        }

        @Test
        @DisplayName("缓存的哈希值不作为公共属性暴露")
        void testCachedHashIsNotExposed() {
            assertThrows(NoSuchMethodException.class, () -> SDBMExpr.class.getMethod("getHashCode"));
            SDBMExpr expr = context.dim(0).stripe(3).subtract(context.symbol(0));
            assertEquals(expr.hashCode(), context.dim(0).stripe(3).subtract(context.symbol(0)).hashCode());
        }

        @Test
        @DisplayName("变体的构造前置条件")
        void testVariantPreconditions() {
            assertThrows(IllegalArgumentException.class, () -> SDBMNegExpr.of(context.constant(1)));
            assertThrows(IllegalArgumentException.class,
                    () -> SDBMSumExpr.of(context.constant(1), context.constant(2)));
            assertThrows(IllegalArgumentException.class,
                    () -> SDBMDiffExpr.of(context.dim(0), context.constant(2)));
        }

        @Test
        @DisplayName("跨上下文组合被拒绝")
        void testCrossContext() {
            SDBMContext other = new SDBMContext();
            assertThrows(IllegalArgumentException.class, () -> context.dim(0).add(other.dim(1).negate()));
            assertThrows(IllegalArgumentException.class, () -> context.dim(0).stripe(other.constant(2)));
        }
    }

    @Nested
    @DisplayName("遍历 (Walk)")
    class WalkTests {

        @Test
        @DisplayName("后序遍历访问所有子表达式")
        void testPostOrder() {
            SDBMExpr expr = context.dim(0).stripe(3).subtract(context.symbol(0)).add(7);
            List<SDBMExpr> visited = new ArrayList<>();
            expr.walk(visited::add);

            SDBMStripeExpr stripe = context.dim(0).stripe(3);
            assertEquals(List.of(
                    context.dim(0), context.constant(3), stripe,
                    context.symbol(0),
                    SDBMDiffExpr.of(stripe, context.symbol(0)),
                    context.constant(7),
                    expr), visited);
        }
    }
}
