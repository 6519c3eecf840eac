package xyz.vvrf.canvas.flow.variable;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.canvas.flow.core.ValidationError;
import xyz.vvrf.canvas.flow.core.VariableResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于正则表达式的默认变量解析器。
 * <p>
 * 支持两种引用写法: {@code {A1}} 与 {@code [A01]}，块编号形如一个字母后跟若干数字。
 * 无法解析的引用原样保留在结果中。
 */
@Slf4j
public class PatternVariableResolver implements VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([A-Za-z]\\d+)\\}|\\[([A-Za-z]\\d+)\\]");

    @Override
    public String resolve(String template, Map<String, String> upstreamData) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuffer resolved = new StringBuffer(template.length());
        while (matcher.find()) {
            String number = referencedNumber(matcher);
            String value = upstreamData.get(number);
            if (value == null) {
                log.debug("Variable {} has no upstream value, keeping it literally", matcher.group());
                value = matcher.group();
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    @Override
    public List<ValidationError> validate(String template, Set<String> availableBlockNumbers) {
        List<ValidationError> errors = new ArrayList<>();
        for (String number : parseVariables(template)) {
            if (!availableBlockNumbers.contains(number)) {
                errors.add(ValidationError.builder()
                        .type(ValidationError.Type.INVALID_VARIABLE)
                        .message(String.format("Variable [%s] references unavailable block %s", number, number))
                        .build());
            }
        }
        return errors;
    }

    /**
     * @return 模板中引用的块编号 (去重，按首次出现顺序)
     */
    public Set<String> parseVariables(String template) {
        if (template == null || template.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> numbers = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        while (matcher.find()) {
            numbers.add(referencedNumber(matcher));
        }
        return numbers;
    }

    public boolean hasVariables(String template) {
        return template != null && VARIABLE_PATTERN.matcher(template).find();
    }

    private static String referencedNumber(Matcher matcher) {
        return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
    }
}
