package xyz.vvrf.canvas.flow.core;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class ValidationResult {
    List<ValidationError> errors;
    List<ValidationWarning> warnings;

    public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(ValidationError.Type type) {
        return errors.stream().anyMatch(e -> e.getType() == type);
    }

    /**
     * @return 以 "; " 连接的全部错误信息
     */
    public String describeErrors() {
        return errors.stream().map(ValidationError::getMessage).collect(Collectors.joining("; "));
    }
}
