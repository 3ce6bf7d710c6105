package cn.bafuka.recall.example.controller;

import cn.bafuka.recall.example.model.HookDecision;
import cn.bafuka.recall.example.model.HookRequest;
import cn.bafuka.recall.example.service.ToolHookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 工具调用 hook 控制器
 * 无决定时返回空对象 {}
 */
@Slf4j
@RestController
@RequestMapping("/api/hooks")
public class HookController {

    @Autowired
    private ToolHookService toolHookService;

    /**
     * 工具执行前
     */
    @PostMapping("/pre-tool")
    public Map<String, Object> preTool(@RequestBody HookRequest request) {
        return wrap(toolHookService.handlePreTool(request));
    }

    /**
     * 工具执行后
     */
    @PostMapping("/post-tool")
    public Map<String, Object> postTool(@RequestBody HookRequest request) {
        return wrap(toolHookService.handlePostTool(request));
    }

    private static Map<String, Object> wrap(Optional<HookDecision> decision) {
        Map<String, Object> result = new HashMap<>();
        decision.ifPresent(d -> result.put("hookSpecificOutput", d));
        return result;
    }
}
