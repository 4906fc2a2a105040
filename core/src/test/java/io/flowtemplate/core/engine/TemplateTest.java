package io.flowtemplate.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowtemplate.core.error.DataNotFoundException;
import io.flowtemplate.core.error.FunctionException;
import io.flowtemplate.core.error.MathException;
import io.flowtemplate.core.error.ParseException;
import io.flowtemplate.core.error.TypeConversionException;
import io.flowtemplate.core.model.Context;
import io.flowtemplate.core.model.JsonValues;
import io.flowtemplate.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link Template}: parsing, rendering, dependency queries and context validation. */
class TemplateTest {

    private static Context alice() {
        return new Context().setInput(JsonValues.parse("{\"name\": \"Alice\", \"greeting\": \"Hi\", \"age\": 30}"));
    }

    @Nested
    @DisplayName("Static templates")
    class StaticTemplates {

        @ParameterizedTest
        @ValueSource(strings = {"plain text", "a } b { c", "multi\nline\ttext", "ünïcødé 😀", "single { brace }"})
        void textWithoutExpressionsRendersVerbatim(String source) {
            Template template = Template.parse(source);

            assertThat(template.isStatic()).isTrue();
            assertThat(template.render(new Context())).isEqualTo(source);
            assertThat(template.dependencies().isEmpty()).isTrue();
        }

        @Test
        void emptyTemplate() {
            Template template = Template.parse("");

            assertThat(template.isStatic()).isTrue();
            assertThat(template.elements()).isEmpty();
            assertThat(template.render(new Context())).isEmpty();
        }

        @Test
        void escapedBracesRenderLiterally() {
            Template template = Template.parse("Use \\{{ name }} for placeholders");

            assertThat(template.isStatic()).isTrue();
            assertThat(template.render(new Context())).isEqualTo("Use {{ name }} for placeholders");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        void substitutesInput() {
            assertThat(Template.parse("Hello {{ $input.name }}!").render(alice())).isEqualTo("Hello Alice!");
        }

        @Test
        void countsExpressions() {
            Template template = Template.parse("{{ $input.greeting }} {{ $input.name }}!");

            assertThat(template.expressionCount()).isEqualTo(2);
            assertThat(template.render(alice())).isEqualTo("Hi Alice!");
        }

        @Test
        void rendersScalarsWithTheirStringForm() {
            assertThat(Template.parse("{{ $input.age }}|{{ 2.5 }}|{{ 6 / 2 }}|{{ null }}|{{ 1 == 1 }}").render(alice()))
                    .isEqualTo("30|2.5|3|null|true");
        }

        @Test
        void conditionalsAndArithmetic() {
            Template template = Template.parse("{{ $input.age < 18 ? 'minor' : 'adult' }} ({{ $input.age + 1 }} next year)");

            assertThat(template.render(alice())).isEqualTo("adult (31 next year)");
        }

        @Test
        void missingInputIsDataNotFound() {
            assertThatThrownBy(() -> Template.parse("{{ $input.name }}").render(new Context()))
                    .isInstanceOfSatisfying(DataNotFoundException.class, ex -> assertThat(ex.path()).isEqualTo("$input"));
        }

        @Test
        void containerResultIsTypeError() {
            Context context = new Context().setInput(JsonValues.parse("{\"tags\": [1, 2], \"user\": {}}"));

            assertThatThrownBy(() -> Template.parse("{{ $input.tags }}").render(context))
                    .isInstanceOfSatisfying(TypeConversionException.class, ex -> {
                        assertThat(ex.from()).isEqualTo("array");
                        assertThat(ex.to()).isEqualTo("string");
                        assertThat(ex.context()).contains("$input.tags");
                    });
            assertThatThrownBy(() -> Template.parse("{{ $input.user }}").render(context))
                    .isInstanceOf(TypeConversionException.class);
        }

        @Test
        void firstFailingExpressionAborts() {
            var calls = new ArrayList<String>();
            var functions = new FunctionTable().register("track", args -> {
                calls.add(args.get(0).asString());
                return args.get(0);
            });
            Template template = Template.parseWithFunctions("{{ track('a') }}{{ 1 / 0 }}{{ track('b') }}", functions);

            assertThatThrownBy(() -> template.render(new Context())).isInstanceOf(MathException.class);
            assertThat(calls).containsExactly("a");
        }

        @Test
        void boundFunctionsAreUsedByDefault() {
            var functions = new FunctionTable().register("upper", args -> Value.of(args.get(0).asString().toUpperCase()));
            Template template = Template.parseWithFunctions("{{ $input.name | upper }}", functions);

            assertThat(template.functions()).isSameAs(functions);
            assertThat(template.render(alice())).isEqualTo("ALICE");
        }

        @Test
        void renderAcceptsAnotherRegistry() {
            Template template = Template.parse("{{ $input.name | upper }}");
            var functions = new FunctionTable().register("upper", args -> Value.of(args.get(0).asString().toUpperCase()));

            assertThatThrownBy(() -> template.render(alice())).isInstanceOf(FunctionException.class);
            assertThat(template.render(alice(), functions)).isEqualTo("ALICE");
        }

        @Test
        void hyphenatedAndQuotedKeys() {
            Context context = new Context()
                    .setInput(JsonValues.parse(
                            "{\"first-name\": \"Al\", \"a-1\": \"x\", \"a\": 5,"
                                    + " \"headers\": {\"content-type\": \"application/json\"}}"))
                    .addNodeOutput("n", JsonValues.parse("{\"headers\": {\"content-type\": \"application/json\"}}"));

            assertThat(Template.parse("{{ $input.first-name }}").render(context)).isEqualTo("Al");
            assertThat(Template.parse("{{ $input.a-1 }}").render(context)).isEqualTo("x");
            assertThat(Template.parse("{{ $input.a - 1 }}").render(context)).isEqualTo("4");
            assertThat(Template.parse("{{ $input.headers.'content-type' }}").render(context)).isEqualTo("application/json");
            assertThat(Template.parse("{{ $node('n').headers.content-type }}").render(context)).isEqualTo("application/json");
        }

        @Test
        void systemDateIsAvailable() {
            assertThat(Template.parse("{{ $system.datetime.date }}").render(new Context())).matches("\\d{4}-\\d{2}-\\d{2}");
        }
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        void unclosedExpressionFails() {
            assertThatThrownBy(() -> Template.parse("{{ unclosed expression"))
                    .isInstanceOfSatisfying(ParseException.class, ex -> {
                        assertThat(ex.position()).isZero();
                        assertThat(ex.template()).isEqualTo("{{ unclosed expression");
                    });
        }

        @Test
        void expressionErrorsCarryTemplatePositions() {
            assertThatThrownBy(() -> Template.parse("ab {{ $bogus }}"))
                    .isInstanceOfSatisfying(ParseException.class, ex -> {
                        assertThat(ex.position()).isEqualTo(6);
                        assertThat(ex.getMessage()).isEqualTo("Parse error at position 6: Unknown data source: $bogus");
                    });
        }

        @Test
        void elementsPreserveOrderAndSource() {
            Template template = Template.parse("Hi {{  $input.name  }}!");

            assertThat(template.elements()).hasSize(3);
            assertThat(template.elements().get(0)).isEqualTo(new TemplateElement.Text("Hi "));
            Expression expr = template.expressions().get(0);
            assertThat(expr.source()).isEqualTo("$input.name");
            assertThat(expr.position()).isEqualTo(3);
            assertThat(expr.isSimpleAccess()).isTrue();
            assertThat(expr.isLiteral()).isFalse();
            assertThat(template.toString()).isEqualTo("Hi {{  $input.name  }}!");
        }

        @Test
        void expressionPositionIsByteOffset() {
            Template template = Template.parse("€ {{ 1 }}");

            assertThat(template.expressions().get(0).position()).isEqualTo(4);
            assertThat(template.expressions().get(0).isLiteral()).isTrue();
        }

        @Test
        void parsingDoesNotRequireFunctionsToExist() {
            assertThatCode(() -> Template.parse("{{ missing(1) }}")).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Dependencies")
    class DependencyQueries {

        @Test
        void collectsEveryDataSourceKind() {
            Template template = Template.parse("{{ $input.name }} {{ $node('test').value }} {{ $env.KEY }}");

            assertThat(template.dependencies().inputPaths()).contains("name");
            assertThat(template.dependencies().nodeIds()).contains("test");
            assertThat(template.dependencies().envVars()).contains("KEY");
        }

        @Test
        void includesBothConditionalBranchesAndFunctions() {
            Template template = Template.parse("{{ $input.flag ? $node('a').x : $node('b').y | fmt }}");

            assertThat(template.dependencies().nodeIds()).containsExactly("a", "b");
            assertThat(template.usesFunction("fmt")).isTrue();
            assertThat(template.usesFunction("other")).isFalse();
        }
    }

    @Nested
    @DisplayName("validateContext")
    class Validation {

        private final Template template =
                Template.parse("{{ $input.flag ? $node('a').x : 'none' }} {{ if(false, $env.TOKEN) }}");

        private Context complete() {
            return new Context()
                    .setInput(Value.object(Map.of("flag", Value.FALSE)))
                    .addNodeOutput("a", Value.NULL)
                    .setEnv("TOKEN", "t");
        }

        @Test
        void passesWhenEverythingIsPresent() {
            assertThatCode(() -> template.validateContext(complete())).doesNotThrowAnyException();
        }

        @Test
        void staticTemplateNeedsNothing() {
            assertThatCode(() -> Template.parse("static").validateContext(new Context())).doesNotThrowAnyException();
        }

        @Test
        void missingInput() {
            assertThatThrownBy(() -> template.validateContext(new Context()))
                    .isInstanceOfSatisfying(DataNotFoundException.class, ex -> {
                        assertThat(ex.path()).isEqualTo("$input");
                        assertThat(ex.available()).containsExactly("Input data required but not provided");
                    });
        }

        @Test
        void missingNodeInUnexecutedBranch() {
            Context context = new Context().setInput(Value.NULL).setEnv("TOKEN", "t");

            assertThatThrownBy(() -> template.validateContext(context))
                    .isInstanceOfSatisfying(DataNotFoundException.class, ex -> {
                        assertThat(ex.path()).isEqualTo("$node('a')");
                        assertThat(ex.available()).contains("$input", "$env.TOKEN");
                    });
        }

        @Test
        void missingEnvironmentVariable() {
            Context context = new Context().setInput(Value.NULL).addNodeOutput("a", Value.NULL);

            assertThatThrownBy(() -> template.validateContext(context))
                    .isInstanceOfSatisfying(DataNotFoundException.class, ex -> {
                        assertThat(ex.path()).isEqualTo("$env.TOKEN");
                        assertThat(ex.available()).containsExactly("Environment variable not set");
                    });
        }
    }

    @Test
    void sharedTemplateRendersConcurrently() throws Exception {
        Template template = Template.parse("{{ $input.id }}-{{ $input.id * 2 }}");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                long id = i;
                results.add(pool.submit(() -> template.render(new Context().setInput(Value.object(Map.of("id", Value.of(id)))))));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(i + "-" + (i * 2));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
