package cn.bafuka.recall.example.service;

import cn.bafuka.recall.annotation.RecallCache;
import cn.bafuka.recall.annotation.RecallEvict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 探索服务
 * 演示 Recall 注解的使用
 */
@Slf4j
@Service
public class ExplorationService {

    /**
     * 在工作目录内执行一次探索（使用 Recall 缓存）
     * 相似的问题在一小时内直接返回上次的结果
     *
     * @param prompt 探索问题
     * @param cwd    工作目录
     * @return 探索结果
     */
    @RecallCache(cache = "exploration", query = "#prompt", scope = "#cwd")
    public String explore(String prompt, String cwd) {
        log.info("执行探索: prompt={}, cwd={}", prompt, cwd);
        // 模拟一次昂贵的探索
        try {
            Thread.sleep(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "Explored " + cwd + " for: " + prompt;
    }

    /**
     * 清空探索缓存
     */
    @RecallEvict(cache = "exploration", allEntries = true)
    public void resetExplorations() {
        log.info("探索缓存已重置");
    }
}
