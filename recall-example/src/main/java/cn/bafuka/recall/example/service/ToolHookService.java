package cn.bafuka.recall.example.service;

import cn.bafuka.recall.control.CacheRegistry;
import cn.bafuka.recall.core.CacheMatch;
import cn.bafuka.recall.core.CacheService;
import cn.bafuka.recall.dataplane.KeyHasher;
import cn.bafuka.recall.dataplane.impl.Md5KeyHasher;
import cn.bafuka.recall.example.model.HookDecision;
import cn.bafuka.recall.example.model.HookRequest;
import cn.bafuka.recall.model.CacheDefinition;
import com.alibaba.fastjson.JSON;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 工具调用 hook 服务
 *
 * <ul>
 *     <li>Task（Explore / quick-explorer 子代理）：exploration 缓存，query = prompt，scope = cwd</li>
 *     <li>WebFetch：research 缓存，query = scope = url</li>
 * </ul>
 *
 * 缓存不可用时一律放行，不影响工具本身的执行
 */
@Slf4j
@Service
public class ToolHookService {

    public static final String TASK_TOOL = "Task";
    public static final String WEB_FETCH_TOOL = "WebFetch";

    private static final Set<String> EXPLORATION_SUBAGENTS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("Explore", "quick-explorer")));

    private static final int EXPLORATION_SUMMARY_LENGTH = 200;
    private static final int RESEARCH_SUMMARY_LENGTH = 500;

    private final CacheRegistry cacheRegistry;

    private final Clock clock;

    private final KeyHasher keyHasher = new Md5KeyHasher();

    public ToolHookService(CacheRegistry cacheRegistry, Clock clock) {
        this.cacheRegistry = cacheRegistry;
        this.clock = clock;
    }

    /**
     * 工具执行前：命中缓存时给出带缓存内容的放行决定
     *
     * @param request hook 请求
     * @return 决定，未命中或不处理时为空
     */
    public Optional<HookDecision> handlePreTool(HookRequest request) {
        if (isExploration(request)) {
            return preExploration(request);
        }
        if (WEB_FETCH_TOOL.equals(request.getToolName())) {
            return preResearch(request);
        }
        return Optional.empty();
    }

    /**
     * 工具执行后：写入结果
     *
     * @param request hook 请求
     * @return 写入 exploration 时返回提示，其余为空
     */
    public Optional<HookDecision> handlePostTool(HookRequest request) {
        if (isExploration(request)) {
            return postExploration(request);
        }
        if (WEB_FETCH_TOOL.equals(request.getToolName())) {
            postResearch(request);
        }
        return Optional.empty();
    }

    private Optional<HookDecision> preExploration(HookRequest request) {
        String prompt = request.inputText("prompt");
        CacheService cache = cacheRegistry.getCache(CacheDefinition.EXPLORATION);
        if (!StringUtils.hasText(prompt) || cache == null) {
            return Optional.empty();
        }

        Optional<CacheMatch> match = cache.lookup(prompt, cwdOf(request));
        if (!match.isPresent()) {
            return Optional.empty();
        }

        long ageMinutes = (long) (match.get().getEntry().ageSeconds(nowSeconds()) / 60);
        String summary = head(match.get().getEntry().getResult(), EXPLORATION_SUMMARY_LENGTH);
        log.info("exploration 缓存命中: subagent={}, type={}, ageMinutes={}",
                request.inputText("subagent_type"), match.get().getMatchType(), ageMinutes);

        return Optional.of(HookDecision.builder()
                .hookEventName(HookDecision.PRE_TOOL_USE)
                .permissionDecision("approve")
                .permissionDecisionReason(String.format(
                        "[Cache Hit] Similar exploration found (%dm ago): %s", ageMinutes, summary))
                .build());
    }

    private Optional<HookDecision> preResearch(HookRequest request) {
        String url = request.inputText("url");
        CacheService cache = cacheRegistry.getCache(CacheDefinition.RESEARCH);
        if (!StringUtils.hasText(url) || cache == null) {
            return Optional.empty();
        }

        Optional<String> cached = cache.lookupResult(url, url);
        if (!cached.isPresent()) {
            return Optional.empty();
        }

        long ttlHours = cache.getDefinition().getTtlSeconds() / 3600;
        log.info("research 缓存命中: url={}", head(url, 80));
        return Optional.of(HookDecision.builder()
                .hookEventName(HookDecision.PRE_TOOL_USE)
                .permissionDecision("allow")
                .permissionDecisionReason(String.format(
                        "[CACHE HIT - %dh fresh] %s\n\nCached content:\n%s\n\n(Consider skipping fetch if this answers your question)",
                        ttlHours, url, head(cached.get(), RESEARCH_SUMMARY_LENGTH)))
                .build());
    }

    private Optional<HookDecision> postExploration(HookRequest request) {
        String prompt = request.inputText("prompt");
        CacheService cache = cacheRegistry.getCache(CacheDefinition.EXPLORATION);
        String content = resultText(request.getToolResult(), "content", "output");
        if (!StringUtils.hasText(prompt) || !StringUtils.hasLength(content) || cache == null) {
            return Optional.empty();
        }

        if (content.length() > cache.getDefinition().getMaxContentSize()) {
            log.info("exploration 结果过大，未缓存: size={}", content.length());
            return Optional.empty();
        }

        String cwd = cwdOf(request);
        cache.store(prompt, cwd, content);
        String key = keyHasher.fingerprint(prompt, cwd);
        log.info("exploration 已缓存: key={}, subagent={}", key, request.inputText("subagent_type"));

        return Optional.of(HookDecision.builder()
                .hookEventName(HookDecision.POST_TOOL_USE)
                .message("[Cache] Exploration cached (key: " + key + ")")
                .build());
    }

    private void postResearch(HookRequest request) {
        String url = request.inputText("url");
        CacheService cache = cacheRegistry.getCache(CacheDefinition.RESEARCH);
        String content = resultText(request.getToolResult(), "content", "text");
        if (content.isEmpty() && request.getToolResult() instanceof Map) {
            content = JSON.toJSONString(request.getToolResult());
        }
        if (!StringUtils.hasText(url) || content.isEmpty() || cache == null) {
            return;
        }

        cache.store(url, url, content);
        log.info("research 已缓存: url={}", head(url, 80));
    }

    private boolean isExploration(HookRequest request) {
        return TASK_TOOL.equals(request.getToolName())
                && EXPLORATION_SUBAGENTS.contains(request.inputText("subagent_type"));
    }

    /**
     * 依次取结果对象中的字段，字符串结果原样返回
     */
    private static String resultText(Object toolResult, String... fields) {
        if (toolResult instanceof String) {
            return (String) toolResult;
        }
        if (toolResult instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) toolResult;
            for (String field : fields) {
                Object value = map.get(field);
                if (value != null && !String.valueOf(value).isEmpty()) {
                    return String.valueOf(value);
                }
            }
        }
        return "";
    }

    private static String cwdOf(HookRequest request) {
        return request.getCwd() == null ? "" : request.getCwd();
    }

    private static String head(String text, int length) {
        if (text == null) {
            return "";
        }
        return text.length() <= length ? text : text.substring(0, length);
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }
}
