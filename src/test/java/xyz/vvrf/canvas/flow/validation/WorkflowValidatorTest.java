package xyz.vvrf.canvas.flow.validation;

import org.junit.jupiter.api.Test;
import xyz.vvrf.canvas.flow.core.ValidationError;
import xyz.vvrf.canvas.flow.core.ValidationResult;
import xyz.vvrf.canvas.flow.core.ValidationWarning;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.test.util.TestGraphs;
import xyz.vvrf.canvas.flow.variable.PatternVariableResolver;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowValidatorTest {

    private final WorkflowValidator validator = new WorkflowValidator(new PatternVariableResolver());

    @Test
    void validChainPasses() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "a cat")
                .image("B1", "draw {A1}")
                .video("C1", "animate [B1] as {A1}")
                .connect("A1", "B1")
                .connect("B1", "C1")
                .build();

        ValidationResult result = validator.validate(graph);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void cycleIsReportedAsCircularDependency() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "y")
                .connect("A1", "B1")
                .connect("B1", "A1")
                .build();

        ValidationResult result = validator.validate(graph);

        assertThat(result.isValid()).isFalse();
        assertThat(result.hasError(ValidationError.Type.CIRCULAR_DEPENDENCY)).isTrue();
        assertThat(result.describeErrors()).contains("Workflow contains circular dependencies: 'b1' -> 'a1'");
        assertThat(result.getErrors().get(0).getBlockId()).isEqualTo("a1");
    }

    @Test
    void danglingConnectionEndpointsAreMissingBlocks() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .connectIds("a1", "nowhere")
                .connectIds("ghost", "a1")
                .build();

        ValidationResult result = validator.validate(graph);

        assertThat(result.getErrors())
                .extracting(ValidationError::getType)
                .containsOnly(ValidationError.Type.MISSING_BLOCK);
        assertThat(result.getErrors())
                .extracting(ValidationError::getMessage)
                .containsExactly(
                        "Connection 'c1' references missing target block: nowhere",
                        "Connection 'c2' references missing source block: ghost");
        assertThat(result.getErrors())
                .extracting(ValidationError::getConnectionId)
                .containsExactly("c1", "c2");
    }

    @Test
    void variableMustReferenceAnUpstreamBlock() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "uses {A1}")
                .build();

        ValidationResult result = validator.validate(graph);

        assertThat(result.isValid()).isFalse();
        ValidationError error = result.getErrors().get(0);
        assertThat(error.getType()).isEqualTo(ValidationError.Type.INVALID_VARIABLE);
        assertThat(error.getBlockId()).isEqualTo("b1");
        assertThat(error.getMessage()).isEqualTo("Variable [A1] references unavailable block A1");
    }

    @Test
    void indirectAncestorsAreReachableForVariables() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "{A1}")
                .text("C1", "{A1} {B1}")
                .connect("A1", "B1")
                .connect("B1", "C1")
                .build();

        assertThat(validator.validate(graph).isValid()).isTrue();
    }

    @Test
    void downstreamReferenceIsInvalid() {
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "needs {B1}")
                .text("B1", "x")
                .connect("A1", "B1")
                .build();

        assertThat(validator.validate(graph).hasError(ValidationError.Type.INVALID_VARIABLE)).isTrue();
    }

    @Test
    void emptyPromptAndManyConnectionsProduceWarningsOnly() {
        WorkflowValidator strict = new WorkflowValidator(new PatternVariableResolver(), 1);
        WorkflowGraph graph = TestGraphs.builder()
                .text("A1", "x")
                .text("B1", "")
                .text("C1", null)
                .connect("A1", "B1")
                .connect("A1", "C1")
                .build();

        ValidationResult result = strict.validate(graph);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .extracting(ValidationWarning::getType)
                .containsExactly(
                        ValidationWarning.Type.PERFORMANCE,
                        ValidationWarning.Type.BEST_PRACTICE,
                        ValidationWarning.Type.BEST_PRACTICE);
        assertThat(result.getWarnings().get(1).getBlockId()).isEqualTo("b1");
    }

    @Test
    void emptyGraphIsValid() {
        assertThat(validator.validate(TestGraphs.builder().build()).isValid()).isTrue();
    }
}
