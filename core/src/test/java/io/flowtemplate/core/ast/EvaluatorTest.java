package io.flowtemplate.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowtemplate.core.engine.FunctionTable;
import io.flowtemplate.core.error.DataNotFoundException;
import io.flowtemplate.core.error.EvaluationException;
import io.flowtemplate.core.error.FunctionException;
import io.flowtemplate.core.error.MathException;
import io.flowtemplate.core.error.SignatureException;
import io.flowtemplate.core.error.TypeConversionException;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.DataSource;
import io.flowtemplate.core.model.JsonValues;
import io.flowtemplate.core.model.Value;
import io.flowtemplate.core.parser.ExpressionParser;
import io.flowtemplate.core.spi.FunctionSignature;
import io.flowtemplate.core.spi.TemplateFunction;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for expression evaluation ({@link ExpressionAst#evaluate}). */
class EvaluatorTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final FunctionTable functions = new FunctionTable();
    private final List<String> calls = new ArrayList<>();
    private Context context;

    @BeforeEach
    void setUp() {
        context = new Context()
                .setInput(JsonValues.parse("{\"name\": \"Alice\", \"n\": 5, \"f\": 2.5, \"flag\": true, \"tags\": [1]}"));
        functions.register("upper", args -> Value.of(args.get(0).asString().toUpperCase()));
        functions.register("join", args -> {
            StringBuilder sb = new StringBuilder();
            args.forEach(a -> sb.append(a.asString()).append('/'));
            return Value.of(sb.toString());
        });
        functions.register("rec", args -> {
            calls.add(args.get(0).asString());
            return args.get(0);
        });
    }

    private Value eval(String expression) {
        return parser.parse(expression).evaluate(context, functions);
    }

    @Nested
    class Arithmetic {

        @Test
        void integerOperandsYieldFloats() {
            assertThat(eval("1 + 2")).isEqualTo(Value.of(3.0));
            assertThat(eval("10 - 4 * 2")).isEqualTo(Value.of(2.0));
            assertThat(eval("$input.n * 3")).isEqualTo(Value.of(15.0));
            assertThat(eval("1 + 2").toString()).isEqualTo("3");
        }

        @Test
        void arithmeticResultComparesAsFloat() {
            assertThat(eval("1 + 2 == 3")).isEqualTo(Value.FALSE);
            assertThat(eval("1 + 2 == 3.0")).isEqualTo(Value.TRUE);
        }

        @Test
        void mixedArithmeticIsFloat() {
            assertThat(eval("1 + 2.5")).isEqualTo(Value.of(3.5));
            assertThat(eval("$input.f * 2")).isEqualTo(Value.of(5.0));
            assertThat(eval("'4' - 1")).isEqualTo(Value.of(3.0));
        }

        @Test
        void addConcatenatesWhenEitherSideIsNotNumeric() {
            assertThat(eval("'a' + 1")).isEqualTo(Value.of("a1"));
            assertThat(eval("$input.name + '!'")).isEqualTo(Value.of("Alice!"));
            assertThat(eval("null + 'x'")).isEqualTo(Value.of("nullx"));
            assertThat(eval("1.5 + 'x'")).isEqualTo(Value.of("1.5x"));
        }

        @Test
        void addingAnArrayIsATypeError() {
            assertThatThrownBy(() -> eval("$input.tags + 'x'")).isInstanceOf(TypeConversionException.class);
        }

        @Test
        void largeIntegersLosePrecisionInsteadOfFailing() {
            assertThat(eval("9223372036854775807 + 1")).isEqualTo(Value.of(9223372036854775808.0));
            assertThat(eval("-(-9223372036854775808)")).isEqualTo(Value.of(9223372036854775808.0));
        }

        @Test
        void divisionIsAlwaysFloat() {
            assertThat(eval("7 / 2")).isEqualTo(Value.of(3.5));
            assertThat(eval("6 / 3")).isEqualTo(Value.of(2.0));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1 / 0", "1 / 0.0", "$input.n / (2 - 2)", "1 / false"})
        void divisionByZeroIsMathError(String expression) {
            assertThatThrownBy(() -> eval(expression))
                    .isInstanceOf(MathException.class)
                    .hasMessage("Math error: Division by zero");
        }

        @Test
        void nonNumericOperandIsTypeError() {
            assertThatThrownBy(() -> eval("'abc' / 2")).isInstanceOf(TypeConversionException.class);
            assertThatThrownBy(() -> eval("5 - 'x'")).isInstanceOf(TypeConversionException.class);
        }

        @Test
        void unaryMinus() {
            assertThat(eval("-$input.n")).isEqualTo(Value.of(-5.0));
            assertThat(eval("-$input.f")).isEqualTo(Value.of(-2.5));
            assertThat(eval("-'3'")).isEqualTo(Value.of(-3.0));
            assertThat(eval("-(2 + 1)")).isEqualTo(Value.of(-3.0));
        }
    }

    @Nested
    class ComparisonAndLogic {

        @Test
        void equalityIsStructuralAndTypeSensitive() {
            assertThat(eval("1 == 1")).isEqualTo(Value.TRUE);
            assertThat(eval("1 == 1.0")).isEqualTo(Value.FALSE);
            assertThat(eval("$input.name == 'Alice'")).isEqualTo(Value.TRUE);
            assertThat(eval("$input.name != 'Bob'")).isEqualTo(Value.TRUE);
        }

        @Test
        void lessThanIsNumeric() {
            assertThat(eval("1 < 2.5")).isEqualTo(Value.TRUE);
            assertThat(eval("'10' < 9")).isEqualTo(Value.FALSE);
        }

        @Test
        void logicalOperatorsUseTruthiness() {
            assertThat(eval("true && 0")).isEqualTo(Value.FALSE);
            assertThat(eval("null || 'x'")).isEqualTo(Value.TRUE);
            assertThat(eval("$input.flag and $input.name")).isEqualTo(Value.TRUE);
            assertThat(eval("!0")).isEqualTo(Value.TRUE);
            assertThat(eval("not ''")).isEqualTo(Value.TRUE);
        }

        @Test
        void logicalOperatorsEvaluateBothSides() {
            assertThatThrownBy(() -> eval("false && $input.missing")).isInstanceOf(DataNotFoundException.class);
            assertThatThrownBy(() -> eval("true || $input.missing")).isInstanceOf(DataNotFoundException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"5 % 2", "1 <= 2", "1 > 2", "1 >= 2", "'ab' contains 'a'", "'ab' startsWith 'a'", "'ab' endsWith 'b'"})
        void undecidedOperatorsAreEvaluationErrors(String expression) {
            assertThatThrownBy(() -> eval(expression))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessageContaining("is not implemented");
        }

        @Test
        void unimplementedOperatorMessageNamesTheOperator() {
            assertThatThrownBy(() -> eval("5 > 3"))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("Evaluation error: Operator '>' (GREATER_THAN) is not implemented");
        }
    }

    @Nested
    class Conditionals {

        @Test
        void ternaryEvaluatesOnlyTheSelectedBranch() {
            assertThat(eval("$input.flag ? 'yes' : $input.missing")).isEqualTo(Value.of("yes"));
            assertThat(eval("0 ? $input.missing : 'no'")).isEqualTo(Value.of("no"));
        }

        @Test
        void ifFunction() {
            assertThat(eval("if(true, 1, 2)")).isEqualTo(Value.of(1));
            assertThat(eval("if('', 1, 2)")).isEqualTo(Value.of(2));
            assertThat(eval("if(false, 1)")).isSameAs(Value.NULL);
            assertThat(eval("if(false, $input.missing, 'safe')")).isEqualTo(Value.of("safe"));
        }
    }

    @Nested
    class Functions {

        @Test
        void directCall() {
            assertThat(eval("upper($input.name)")).isEqualTo(Value.of("ALICE"));
        }

        @Test
        void pipelinePassesRunningValueFirst() {
            assertThat(eval("$input.name | upper")).isEqualTo(Value.of("ALICE"));
            assertThat(eval("'a' | join('b', 'c') | upper")).isEqualTo(Value.of("A/B/C/"));
        }

        @Test
        void argumentsAreEvaluatedLeftToRight() {
            eval("join(rec('1'), rec('2')) + rec('3')");

            assertThat(calls).containsExactly("1", "2", "3");
        }

        @Test
        void unknownFunction() {
            assertThatThrownBy(() -> eval("nope(1)"))
                    .isInstanceOfSatisfying(FunctionException.class, ex -> {
                        assertThat(ex.function()).isEqualTo("nope");
                        assertThat(ex.detail()).isEqualTo("Function not found");
                    });
            assertThatThrownBy(() -> eval("1 | nope")).isInstanceOf(FunctionException.class);
        }

        @Test
        void runtimeFailuresAreWrapped() {
            var boom = new IllegalStateException("boom");
            functions.register("fail", args -> {
                throw boom;
            });

            assertThatThrownBy(() -> eval("fail(1, 'x')"))
                    .isInstanceOfSatisfying(FunctionException.class, ex -> {
                        assertThat(ex.function()).isEqualTo("fail");
                        assertThat(ex.detail()).isEqualTo("boom");
                        assertThat(ex.args()).containsExactly("1", "x");
                        assertThat(ex.getCause()).isSameAs(boom);
                    });
        }

        @Test
        void templateErrorsPassThroughUnchanged() {
            var math = new MathException("custom");
            functions.register("div", args -> {
                throw math;
            });

            assertThatThrownBy(() -> eval("div()")).isSameAs(math);
        }

        @Test
        void nullResultIsFunctionError() {
            functions.register("void", args -> null);

            assertThatThrownBy(() -> eval("void()"))
                    .isInstanceOf(FunctionException.class)
                    .hasMessageContaining("no value");
        }

        @Test
        void signatureIsCheckedBeforeInvocation() {
            functions.register("one", new TemplateFunction() {
                @Override
                public Value invoke(List<Value> args) {
                    calls.add("invoked");
                    return Value.NULL;
                }

                @Override
                public FunctionSignature signature() {
                    return FunctionSignature.exactly(1);
                }
            });

            assertThatThrownBy(() -> eval("one(1, 2)"))
                    .isInstanceOfSatisfying(SignatureException.class, ex -> {
                        assertThat(ex.function()).isEqualTo("one");
                        assertThat(ex.detail()).isEqualTo("expected 1 argument but got 2");
                    });
            assertThatThrownBy(() -> eval("1 | one(2)")).isInstanceOf(SignatureException.class);
            assertThat(calls).isEmpty();
        }

        @Test
        void argumentListIsUnmodifiable() {
            functions.register("mutate", args -> {
                args.clear();
                return Value.NULL;
            });

            assertThatThrownBy(() -> eval("mutate(1)"))
                    .isInstanceOf(FunctionException.class)
                    .hasCauseInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    void handBuiltTreeEvaluates() {
        var tree = new ExpressionAst.BinaryOp(
                new ExpressionAst.DataAccess(DataSource.INPUT, "n"),
                BinaryOperator.ADD,
                new ExpressionAst.Literal(Value.of(1)));

        assertThat(tree.evaluate(context, functions)).isEqualTo(Value.of(6.0));
    }
}
