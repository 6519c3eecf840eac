package xyz.vvrf.canvas.flow.validation;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.Connection;
import xyz.vvrf.canvas.flow.core.ValidationError;
import xyz.vvrf.canvas.flow.core.ValidationResult;
import xyz.vvrf.canvas.flow.core.ValidationWarning;
import xyz.vvrf.canvas.flow.core.VariableResolver;
import xyz.vvrf.canvas.flow.core.WorkflowGraph;
import xyz.vvrf.canvas.flow.util.GraphUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 工作流图的结构校验。
 * <p>
 * 三项检查互相独立，结果合并后返回，不会在第一个错误处中断:
 * <ol>
 *     <li>循环依赖 (DFS 回边检测)</li>
 *     <li>连接引用了不存在的块</li>
 *     <li>提示词变量引用了非上游块</li>
 * </ol>
 * 另外会给出不影响调度的警告。
 */
@Slf4j
public class WorkflowValidator {

    public static final int DEFAULT_CONNECTION_WARNING_THRESHOLD = 20;

    private final VariableResolver variableResolver;
    private final int connectionWarningThreshold;

    public WorkflowValidator(VariableResolver variableResolver) {
        this(variableResolver, DEFAULT_CONNECTION_WARNING_THRESHOLD);
    }

    public WorkflowValidator(VariableResolver variableResolver, int connectionWarningThreshold) {
        this.variableResolver = Objects.requireNonNull(variableResolver, "VariableResolver cannot be null");
        this.connectionWarningThreshold = connectionWarningThreshold;
    }

    public ValidationResult validate(WorkflowGraph graph) {
        Objects.requireNonNull(graph, "WorkflowGraph cannot be null");
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        errors.addAll(checkCycles(graph));
        errors.addAll(checkDanglingConnections(graph));
        errors.addAll(checkVariableReachability(graph));
        warnings.addAll(collectWarnings(graph));

        ValidationResult result = new ValidationResult(errors, warnings);
        if (result.isValid()) {
            log.debug("Workflow validation passed: {} blocks, {} connections, {} warning(s)",
                    graph.size(), graph.getConnections().size(), warnings.size());
        } else {
            log.debug("Workflow validation failed with {} error(s): {}", errors.size(), result.describeErrors());
        }
        return result;
    }

    private List<ValidationError> checkCycles(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        for (GraphUtils.BackEdge backEdge : GraphUtils.detectCycles(graph.blockIds(), graph.getConnections())) {
            errors.add(ValidationError.builder()
                    .type(ValidationError.Type.CIRCULAR_DEPENDENCY)
                    .message("Workflow contains circular dependencies: " + backEdge)
                    .blockId(backEdge.getToId())
                    .build());
        }
        return errors;
    }

    private List<ValidationError> checkDanglingConnections(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        for (Connection connection : graph.getConnections()) {
            if (!graph.findBlock(connection.getFromId()).isPresent()) {
                errors.add(ValidationError.builder()
                        .type(ValidationError.Type.MISSING_BLOCK)
                        .message(String.format("Connection '%s' references missing source block: %s",
                                connection.getId(), connection.getFromId()))
                        .connectionId(connection.getId())
                        .build());
            }
            if (!graph.findBlock(connection.getToId()).isPresent()) {
                errors.add(ValidationError.builder()
                        .type(ValidationError.Type.MISSING_BLOCK)
                        .message(String.format("Connection '%s' references missing target block: %s",
                                connection.getId(), connection.getToId()))
                        .connectionId(connection.getId())
                        .build());
            }
        }
        return errors;
    }

    private List<ValidationError> checkVariableReachability(WorkflowGraph graph) {
        List<ValidationError> errors = new ArrayList<>();
        Set<String> blockIds = graph.blockIds();
        for (Block block : graph.getBlocks()) {
            if (!block.hasPrompt()) {
                continue;
            }
            Set<String> availableNumbers = new LinkedHashSet<>();
            for (String upstreamId : GraphUtils.collectUpstream(block.getId(), blockIds, graph.getConnections())) {
                graph.findBlock(upstreamId).ifPresent(upstream -> availableNumbers.add(upstream.getNumber()));
            }
            for (ValidationError error : variableResolver.validate(block.getPromptTemplate(), availableNumbers)) {
                errors.add(error.toBuilder().blockId(block.getId()).build());
            }
        }
        return errors;
    }

    private List<ValidationWarning> collectWarnings(WorkflowGraph graph) {
        List<ValidationWarning> warnings = new ArrayList<>();
        if (graph.getConnections().size() > connectionWarningThreshold) {
            warnings.add(ValidationWarning.builder()
                    .type(ValidationWarning.Type.PERFORMANCE)
                    .message(String.format("Workflow has %d connections (threshold %d), execution may be slow",
                            graph.getConnections().size(), connectionWarningThreshold))
                    .build());
        }
        for (Block block : graph.getBlocks()) {
            if (!block.hasPrompt()) {
                warnings.add(ValidationWarning.builder()
                        .type(ValidationWarning.Type.BEST_PRACTICE)
                        .message(String.format("Block %s has an empty prompt", block.getNumber()))
                        .blockId(block.getId())
                        .build());
            }
        }
        return warnings;
    }
}
