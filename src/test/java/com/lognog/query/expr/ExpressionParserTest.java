package com.lognog.query.expr;

import com.lognog.query.CompilePhase;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.lexer.DslLexer;
import com.lognog.query.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ExpressionParser
 */
@DisplayName("ExpressionParser Tests")
class ExpressionParserTest {

    private DslLexer lexer;
    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        lexer = new DslLexer();
        parser = new ExpressionParser(FunctionRegistry.standard());
    }

    private Expression build(String text) {
        return parser.build(lexer.tokenize(text));
    }

    @Test
    @DisplayName("Multiplication should bind tighter than addition")
    void shouldRespectArithmeticPrecedence() {
        assertThat(build("1 + 2 * 3").toString()).isEqualTo("(1 + (2 * 3))");
        assertThat(build("(1 + 2) * 3").toString()).isEqualTo("((1 + 2) * 3)");
        assertThat(build("bytes / 1024 % 8").toString()).isEqualTo("((bytes / 1024) % 8)");
    }

    @Test
    @DisplayName("Boolean operators should bind looser than comparisons")
    void shouldRespectBooleanPrecedence() {
        // When
        Expression expression = build("a = 1 AND b > 2 OR NOT c < 3");

        // Then
        assertThat(expression).isInstanceOf(BinaryExpression.class);
        assertThat(((BinaryExpression) expression).getOperator()).isEqualTo(BinaryOperator.OR);
        assertThat(expression.toString()).isEqualTo("(((a = 1) AND (b > 2)) OR NOT (c < 3))");
    }

    @Test
    @DisplayName("Unary minus folds into number literals")
    void shouldFoldNegativeNumbers() {
        Expression negativeNumber = build("-5");
        assertThat(negativeNumber).isInstanceOf(LiteralExpression.class);
        assertThat(((LiteralExpression) negativeNumber).getText()).isEqualTo("-5");

        Expression negatedField = build("-bytes");
        assertThat(negatedField).isInstanceOf(UnaryExpression.class);
        assertThat(((UnaryExpression) negatedField).getOperator()).isEqualTo(UnaryExpression.Operator.NEGATE);
    }

    @Test
    @DisplayName("true, false and null are literals, not fields")
    void shouldRecogniseKeywordLiterals() {
        assertThat(((LiteralExpression) build("TRUE")).getKind()).isEqualTo(LiteralExpression.Kind.BOOLEAN);
        assertThat(((LiteralExpression) build("false")).getKind()).isEqualTo(LiteralExpression.Kind.BOOLEAN);
        assertThat(((LiteralExpression) build("null")).getKind()).isEqualTo(LiteralExpression.Kind.NULL);
        assertThat(build("hostname")).isInstanceOf(FieldRefExpression.class);
    }

    @Test
    @DisplayName("Function names are case-insensitive and normalised")
    void shouldNormaliseFunctionNames() {
        // When
        Expression expression = build("LOWER(concat(host, \"-\", app))");

        // Then
        assertThat(expression).isInstanceOf(FunctionCallExpression.class);
        FunctionCallExpression call = (FunctionCallExpression) expression;
        assertThat(call.getName()).isEqualTo("lower");
        assertThat(((FunctionCallExpression) call.getArguments().get(0)).getArguments()).hasSize(3);
    }

    @Test
    @DisplayName("if() should become a single-branch conditional")
    void shouldParseIf() {
        // When
        ConditionalExpression conditional = (ConditionalExpression) build("if(severity <= 3, \"high\", \"low\")");

        // Then
        assertThat(conditional.getFunction()).isEqualTo("if");
        assertThat(conditional.getBranches()).hasSize(1);
        assertThat(conditional.getOtherwise().toString()).isEqualTo("\"low\"");
    }

    @Test
    @DisplayName("case() with an even argument count has no default")
    void shouldParseCaseWithoutDefault() {
        ConditionalExpression conditional =
            (ConditionalExpression) build("case(severity <= 3, \"high\", severity <= 5, \"medium\")");

        assertThat(conditional.getBranches()).hasSize(2);
        assertThat(conditional.hasOtherwise()).isFalse();
    }

    @Test
    @DisplayName("case() with an odd argument count takes the last value as default")
    void shouldParseCaseWithDefault() {
        ConditionalExpression conditional =
            (ConditionalExpression) build("case(severity <= 3, \"high\", severity <= 5, \"medium\", \"low\")");

        assertThat(conditional.getBranches()).hasSize(2);
        assertThat(conditional.getOtherwise().toString()).isEqualTo("\"low\"");
    }

    @Test
    @DisplayName("case() ending in a condition without value is rejected")
    void shouldRejectCaseEndingInCondition() {
        assertThatThrownBy(() -> build("case(severity <= 3, \"high\", severity <= 5)"))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("case() argument 3 is a condition without a value");

        assertThatThrownBy(() -> build("case(a = 1, \"x\", isnull(b))"))
            .isInstanceOf(ExpressionException.class);
    }

    @Test
    @DisplayName("Unknown functions are expression errors with a position")
    void shouldRejectUnknownFunction() {
        assertThatThrownBy(() -> build("1 + frob(bytes)"))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("Unknown function 'frob'")
            .satisfies(e -> {
                ExpressionException error = (ExpressionException) e;
                assertThat(error.getStage()).isEqualTo(CompilePhase.EXPR);
                assertThat(error.getPosition()).isEqualTo(4);
            });
    }

    @Test
    @DisplayName("Wrong argument counts are rejected")
    void shouldRejectWrongArity() {
        assertThatThrownBy(() -> build("round(1, 2, 3)"))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("takes 1-2 argument(s) but got 3");

        assertThatThrownBy(() -> build("pi(1)"))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("takes 0 argument(s)");
    }

    @Test
    @DisplayName("Chained comparisons and trailing tokens are parse errors")
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> build("a < b < c"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("cannot be chained");

        assertThatThrownBy(() -> build("1 2"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Expected end of expression");

        assertThatThrownBy(() -> build("round(1,"))
            .isInstanceOf(ParseException.class);
    }
}
