package com.connector.service.impl;

import com.connector.exception.EvaluationException;
import com.connector.expression.Scope;
import com.connector.model.AppContext;
import com.connector.service.api.FunctionRegistry;
import com.connector.support.Fixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.connector.support.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpressionEvaluatorImplTest {

    @Mock
    private FunctionRegistry functionRegistry;

    private ExpressionEvaluatorImpl evaluator;
    private Scope scope;

    @BeforeEach
    void setUp() {
        evaluator = Fixtures.evaluator(Fixtures.fixedClock(), functionRegistry);
        scope = Scope.of(new AppContext("crm", json("{\"region\": \"eu\"}")))
                .with(Scope.PARAMETERS, json("{\"name\": \"Ada\", \"count\": 3, \"tags\": [\"a\", \"b\", \"c\"], \"empty\": \"\"}"))
                .with(Scope.BODY, json("{\"items\": [{\"id\": 1, \"type\": \"x\"}, {\"id\": 2, \"type\": \"y\"}], \"ok\": true}"));
    }

    @Test
    void evaluate_shouldReturnNonTemplatedValuesUnchanged() {
        // --- Arrange ---
        JsonNode template = json("{\"plain\": \"text\", \"number\": 5, \"nested\": [true, null]}");

        // --- Act ---
        JsonNode result = evaluator.evaluate(template, scope);

        // --- Assert ---
        assertThat(result).isEqualTo(template);
    }

    @Test
    void evaluate_shouldKeepTheTypeOfASingleExpression() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluate(TextNode.valueOf("{{parameters.count}}"), scope).isNumber()).isTrue();
        assertThat(evaluator.evaluate(TextNode.valueOf("{{body.items}}"), scope).isArray()).isTrue();
        assertThat(evaluator.evaluate(TextNode.valueOf("{{body.ok}}"), scope).booleanValue()).isTrue();
    }

    @Test
    void evaluate_shouldConcatenateMixedTemplatesAsText() {
        // --- Act ---
        JsonNode result = evaluator.evaluate(TextNode.valueOf("Hello {{parameters.name}}, you have {{parameters.count}} items"), scope);

        // --- Assert ---
        assertThat(result.asText()).isEqualTo("Hello Ada, you have 3 items");
    }

    @Test
    void evaluate_shouldSpliceObjectsAndEvaluateKeys() {
        // --- Arrange ---
        JsonNode template = json("{\"{{...}}\": \"{{body.items.0}}\", \"{{parameters.name}}\": \"{{common.region}}\"}");

        // --- Act ---
        JsonNode result = evaluator.evaluate(template, scope);

        // --- Assert ---
        assertThat(result).isEqualTo(json("{\"id\": 1, \"type\": \"x\", \"Ada\": \"eu\"}"));
    }

    @Test
    void evaluate_shouldRejectSplicingANonObject() {
        // --- Arrange ---
        JsonNode template = json("{\"{{...}}\": \"{{parameters.tags}}\"}");

        // --- Act & Assert ---
        assertThatThrownBy(() -> evaluator.evaluate(template, scope))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("must evaluate to an object");
    }

    @Test
    void evaluate_shouldResolveUndefinedVariablesToNull() {
        // --- Act ---
        JsonNode result = evaluator.evaluate(TextNode.valueOf("{{parameters.missing.deeper}}"), scope);

        // --- Assert ---
        assertThat(result.isNull()).isTrue();
        assertThat(evaluator.evaluateText("[{{parameters.missing}}]", scope)).isEqualTo("[]");
    }

    @Test
    void evaluate_shouldReturnTheDecidingOperandOfLogicalOperators() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluateText("{{parameters.empty || 'fallback'}}", scope)).isEqualTo("fallback");
        assertThat(evaluator.evaluateText("{{parameters.name || 'fallback'}}", scope)).isEqualTo("Ada");
        assertThat(evaluator.evaluate(TextNode.valueOf("{{parameters.empty && parameters.name}}"), scope).asText()).isEmpty();
    }

    @Test
    void evaluate_shouldSupportIndexingFromTheEnd() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluateText("{{parameters.tags[-1]}}", scope)).isEqualTo("c");
        assertThat(evaluator.evaluateText("{{parameters.tags[0]}}", scope)).isEqualTo("a");
        assertThat(evaluator.evaluateText("{{body.items[1].id}}", scope)).isEqualTo("2");
    }

    @Test
    void evaluate_shouldApplyArithmeticAndComparisons() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluate(TextNode.valueOf("{{parameters.count * 2 + 1}}"), scope).asInt()).isEqualTo(7);
        assertThat(evaluator.evaluateCondition(TextNode.valueOf("{{parameters.count >= 3}}"), scope, false)).isTrue();
        assertThat(evaluator.evaluateCondition(TextNode.valueOf("{{parameters.count = '3'}}"), scope, false)).isTrue();
    }

    @Test
    void evaluate_shouldCallBuiltinFunctionsWithSemicolonSeparatedArguments() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluate(TextNode.valueOf("{{map(body.items; 'id')}}"), scope)).isEqualTo(json("[1, 2]"));
        assertThat(evaluator.evaluate(TextNode.valueOf("{{map(body.items; 'id'; 'type'; 'y')}}"), scope)).isEqualTo(json("[2]"));
        assertThat(evaluator.evaluateCondition(TextNode.valueOf("{{contains(map(body.items; 'type'); 'x')}}"), scope, false)).isTrue();
        assertThat(evaluator.evaluateText("{{join(parameters.tags; '-')}}", scope)).isEqualTo("a-b-c");
        assertThat(evaluator.evaluateText("{{upper(substring(parameters.name; 0; 2))}}", scope)).isEqualTo("AD");
        assertThat(evaluator.evaluateText("{{now}}", scope)).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(evaluator.evaluateText("{{addDays(now; 1)}}", scope)).isEqualTo("2024-05-02T12:00:00Z");
    }

    @Test
    void evaluate_shouldOnlyEvaluateTheSelectedBranchOfIf() {
        // --- Act ---
        String result = evaluator.evaluateText("{{if(parameters.count > 1; 'many'; unknownFunction())}}", scope);

        // --- Assert ---
        assertThat(result).isEqualTo("many");
    }

    @Test
    void evaluate_shouldDelegateUnknownNamesToUserFunctions() {
        // --- Arrange ---
        when(functionRegistry.contains("crm", "greet")).thenReturn(true);
        when(functionRegistry.invoke(eq("crm"), eq("greet"), anyList(), anyString())).thenReturn(TextNode.valueOf("hi Ada"));

        // --- Act ---
        String result = evaluator.evaluateText("{{greet(parameters.name)}}", scope);

        // --- Assert ---
        assertThat(result).isEqualTo("hi Ada");
        verify(functionRegistry).invoke(eq("crm"), eq("greet"), eq(List.of(TextNode.valueOf("Ada"))), anyString());
    }

    @Test
    void evaluate_shouldPreferBuiltinsOverUserFunctions() {
        // --- Act ---
        String result = evaluator.evaluateText("{{lower('ABC')}}", scope);

        // --- Assert ---
        assertThat(result).isEqualTo("abc");
        verify(functionRegistry, never()).invoke(anyString(), anyString(), anyList(), anyString());
    }

    @Test
    void evaluate_shouldReportUnknownFunctionsWithTheExpression() {
        // --- Act & Assert ---
        assertThatThrownBy(() -> evaluator.evaluateText("{{nope(1)}}", scope))
                .isInstanceOfSatisfying(EvaluationException.class, e -> {
                    assertThat(e.getFunctionName()).isEqualTo("nope");
                    assertThat(e.getExpression()).isEqualTo("nope(1)");
                });
    }

    @Test
    void evaluate_shouldReportSyntaxErrors() {
        // --- Act & Assert ---
        assertThatThrownBy(() -> evaluator.evaluateText("{{parameters.name +}}", scope))
                .isInstanceOf(EvaluationException.class);
        assertThatThrownBy(() -> evaluator.evaluateText("{{parameters.name", scope))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void evaluateCondition_shouldUseTheDefaultWhenNoConditionIsGiven() {
        // --- Act & Assert ---
        assertThat(evaluator.evaluateCondition(null, scope, true)).isTrue();
        assertThat(evaluator.evaluateCondition(null, scope, false)).isFalse();
        assertThat(evaluator.evaluateCondition(TextNode.valueOf("{{parameters.empty}}"), scope, true)).isFalse();
    }
}
