package xyz.vvrf.canvas.flow.execution;

import lombok.Getter;
import xyz.vvrf.canvas.flow.core.ValidationResult;

/**
 * 图未通过结构校验时抛出。此时没有创建任何执行上下文。
 */
@Getter
public class WorkflowValidationException extends RuntimeException {

    private final transient ValidationResult validationResult;

    public WorkflowValidationException(ValidationResult validationResult) {
        super("Workflow validation failed: " + validationResult.describeErrors());
        this.validationResult = validationResult;
    }
}
