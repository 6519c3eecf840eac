package xyz.vvrf.canvas.flow.core;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提示词变量解析器。
 * 变量引用以块编号为键，其语法由实现决定。
 */
public interface VariableResolver {

    /**
     * 使用上游输出替换模板中的变量引用。
     * 对格式正确的模板不应抛出异常，无法解析的引用按实现策略保留或置空。
     *
     * @param template     提示词模板
     * @param upstreamData 块编号 -> 输出
     * @return 解析后的提示词
     */
    String resolve(String template, Map<String, String> upstreamData);

    /**
     * 检查模板中的每个引用是否都指向可用的块编号。
     *
     * @param template               提示词模板
     * @param availableBlockNumbers 当前块所有上游块的编号
     * @return 每个越界引用对应一个 {@link ValidationError.Type#INVALID_VARIABLE} 错误，无问题时为空列表
     */
    List<ValidationError> validate(String template, Set<String> availableBlockNumbers);
}
