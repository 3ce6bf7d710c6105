package cn.bafuka.recall.example.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 工具调用 hook 请求
 * post-tool 请求额外携带 tool_result
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HookRequest {

    @JsonProperty("tool_name")
    private String toolName;

    @JsonProperty("tool_input")
    @Builder.Default
    private Map<String, Object> toolInput = new HashMap<>();

    /**
     * 字符串或对象
     */
    @JsonProperty("tool_result")
    private Object toolResult;

    private String cwd;

    /**
     * 读取 tool_input 中的字符串字段，缺失时返回空串
     */
    public String inputText(String field) {
        if (toolInput == null) {
            return "";
        }
        Object value = toolInput.get(field);
        return value == null ? "" : String.valueOf(value);
    }
}
