package com.pagefrontier.core.util;

import com.pagefrontier.core.model.CrawlJobConfig;
import com.pagefrontier.core.model.JobConfigException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * 프로젝트 job.yml 을 읽어 CrawlJobConfig 로 변환.
 *
 * 예상 YAML 키 (scrape_job 섹션이 없으면 최상위에서 읽음):
 * name: "docs-project"
 * scrape_job:
 *   name: "guide"
 *   seed_urls: ["https://docs.example.com/guide/intro"]
 *   follow_links: true
 *   domain_restricted: true
 *   path_restricted: true
 *   exclusion_patterns: ["/changelog", "re:\\.pdf$"]
 *   max_pages: 50        # null 이면 무제한
 *   max_depth: 3         # null 이면 무제한
 *   max_workers: 3
 *   max_fetch_attempts: 3
 *   rps: 5
 *   output_dir: "output"
 * reader:
 *   endpoint: "https://r.jina.ai/"
 *   api_key_env: "JINA_API_KEY"
 *   timeout_ms: 30000
 *   retry_attempts: 3
 *   retry_base_ms: 500
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlJobConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("job config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(yaml().load(in));
        } catch (YAMLException e) {
            throw new JobConfigException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    /** 문자열 YAML 버전(테스트/임베딩용) */
    public static CrawlJobConfig loadString(String yamlText) {
        try (Reader r = new StringReader(yamlText == null ? "" : yamlText)) {
            return parse(yaml().load(r));
        } catch (YAMLException e) {
            throw new JobConfigException("invalid YAML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException(e); // StringReader 는 IOException 을 던지지 않음
        }
    }

    private static Yaml yaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static CrawlJobConfig parse(Object root) {
        CrawlJobConfig cfg = CrawlJobConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라 → seed 없음으로 validate 실패
            cfg.validate();
            return cfg;
        }

        setString(map, "name", cfg::setName);
        Map<String, Object> job = getMap(map, "scrape_job");
        Map<?, ?> src = (job != null) ? job : map;

        // 1) scrape_job.*
        setString(src, "name", cfg::setName);
        setStringList(src, "seed_urls", cfg::setSeedUrls);
        setBoolean(src, "follow_links", cfg::setFollowLinks);
        setBoolean(src, "domain_restricted", cfg::setDomainRestricted);
        setBoolean(src, "path_restricted", cfg::setPathRestricted);
        setStringList(src, "exclusion_patterns", cfg::setExclusionPatterns);
        setNullableInt(src, "max_pages", cfg::setMaxPages);
        setNullableInt(src, "max_depth", cfg::setMaxDepth);
        setInt(src, "max_workers", cfg::setMaxWorkers);
        setInt(src, "max_fetch_attempts", cfg::setMaxFetchAttempts);
        setInt(src, "rps", cfg::setRps);
        setString(src, "output_dir", s -> cfg.setOutputDir(Path.of(s)));

        // 2) reader.* (최상위 또는 scrape_job 아래)
        Map<String, Object> reader = getMap(map, "reader");
        if (reader == null) reader = getMap(src, "reader");
        if (reader != null) {
            var r = cfg.getReader();
            setString(reader, "endpoint", r::setEndpoint);
            setString(reader, "api_key_env", r::setApiKeyEnv);
            setInt(reader, "timeout_ms", ms -> r.setTimeoutMs(ms));
            setInt(reader, "retry_attempts", r::setRetryAttempts);
            setInt(reader, "retry_base_ms", ms -> r.setRetryBaseMs(ms));
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toInt(key, v));
    }

    /** 키가 있고 값이 null 이면 null(무제한)로 설정 */
    private static void setNullableInt(Map<?, ?> map, String key, Consumer<Integer> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        setter.accept(v == null ? null : toInt(key, v));
    }

    private static int toInt(String key, Object v) {
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new JobConfigException(key + " must be an integer: " + v, e);
        }
    }
}
