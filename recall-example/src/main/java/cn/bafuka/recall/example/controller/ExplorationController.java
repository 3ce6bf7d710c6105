package cn.bafuka.recall.example.controller;

import cn.bafuka.recall.example.service.ExplorationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 探索控制器
 */
@RestController
@RequestMapping("/api/explorations")
public class ExplorationController {

    @Autowired
    private ExplorationService explorationService;

    @GetMapping
    public Map<String, Object> explore(@RequestParam String prompt, @RequestParam(defaultValue = "") String cwd) {
        long startTime = System.currentTimeMillis();
        String data = explorationService.explore(prompt, cwd);

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", data);
        result.put("duration", (System.currentTimeMillis() - startTime) + "ms");
        return result;
    }

    @DeleteMapping
    public Map<String, Object> reset() {
        explorationService.resetExplorations();
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "探索缓存已重置");
        return result;
    }
}
