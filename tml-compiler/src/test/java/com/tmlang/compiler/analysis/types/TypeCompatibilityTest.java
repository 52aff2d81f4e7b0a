package com.tmlang.compiler.analysis.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("类型兼容性")
class TypeCompatibilityTest {

    private static List<PrimitiveType> integers() {
        List<PrimitiveType> result = new ArrayList<PrimitiveType>();
        for (PrimitiveType p : Types.allPrimitives()) {
            if (p.getKind().isInteger()) result.add(p);
        }
        return result;
    }

    @Nested
    @DisplayName("基本类型")
    class Primitives {

        @Test
        @DisplayName("任意两个整数类型互相兼容")
        void allIntegerPairsCompatible() {
            List<PrimitiveType> ints = integers();
            assertEquals(10, ints.size());
            for (PrimitiveType a : ints) {
                for (PrimitiveType b : ints) {
                    assertTrue(TypeCompatibility.isCompatible(a, b), a + " vs " + b);
                }
            }
        }

        @Test
        @DisplayName("整数与浮点数双向不兼容")
        void integerAndFloatIncompatible() {
            for (PrimitiveType i : integers()) {
                for (PrimitiveType f : new PrimitiveType[]{Types.F32, Types.F64}) {
                    assertFalse(TypeCompatibility.isCompatible(i, f), i + " <- " + f);
                    assertFalse(TypeCompatibility.isCompatible(f, i), f + " <- " + i);
                }
            }
        }

        @Test
        @DisplayName("浮点数之间兼容")
        void floatsCompatible() {
            assertTrue(TypeCompatibility.isCompatible(Types.F32, Types.F64));
            assertTrue(TypeCompatibility.isCompatible(Types.F64, Types.F32));
        }

        @Test
        @DisplayName("Bool 与整数不兼容")
        void boolNotInteger() {
            assertFalse(TypeCompatibility.isCompatible(Types.BOOL, Types.I32));
        }
    }

    @Nested
    @DisplayName("数组与切片")
    class Arrays {

        @Test
        @DisplayName("长度相同、元素兼容的数组兼容")
        void sameLengthCompatible() {
            assertTrue(TypeCompatibility.isCompatible(Types.array(Types.I64, 4), Types.array(Types.I32, 4)));
        }

        @Test
        @DisplayName("长度不同的数组不兼容")
        void differentLengthIncompatible() {
            assertFalse(TypeCompatibility.isCompatible(Types.array(Types.I32, 4), Types.array(Types.I32, 5)));
        }

        @Test
        @DisplayName("数组可用于同元素的切片")
        void arrayToSlice() {
            assertTrue(TypeCompatibility.isCompatible(Types.slice(Types.I32), Types.array(Types.I32, 3)));
            assertFalse(TypeCompatibility.isCompatible(Types.slice(Types.F32), Types.array(Types.I32, 3)));
        }

        @Test
        @DisplayName("数组可用于 List[T]")
        void arrayToList() {
            assertTrue(TypeCompatibility.isCompatible(Types.named("List", Types.I32), Types.array(Types.I32, 2)));
        }
    }

    @Nested
    @DisplayName("其他规则")
    class Others {

        @Test
        @DisplayName("null 与任意指针兼容")
        void nullPointer() {
            assertTrue(TypeCompatibility.isCompatible(Types.ptr(Types.I32), Types.NULL_PTR));
            assertTrue(TypeCompatibility.isCompatible(Types.NULL_PTR, Types.mutPtr(Types.STR)));
        }

        @Test
        @DisplayName("类型变量与任意类型兼容")
        void typeVarCompatible() {
            TypeVar v = new TypeVarBindings().fresh();
            assertTrue(TypeCompatibility.isCompatible(v, Types.STR));
            assertTrue(TypeCompatibility.isCompatible(Types.tuple(Types.I32), v));
        }

        @Test
        @DisplayName("严格相等不使用兼容规则")
        void strictEquality() {
            assertFalse(TypeCompatibility.typesEqual(Types.I32, Types.I64));
            assertTrue(TypeCompatibility.typesEqual(Types.array(Types.I32, 3), Types.array(Types.I32, 3)));
        }
    }
}
