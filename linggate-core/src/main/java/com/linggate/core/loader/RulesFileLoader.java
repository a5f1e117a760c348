package com.linggate.core.loader;

import com.linggate.api.exception.RulesLoadException;
import com.linggate.core.rule.PredicateReference;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 规则文件加载器
 * <p>
 * 文件为 YAML（JSON 是 YAML 子集，同样可用），顶层结构与内联规则一致。
 * 相对路径基于工作目录 (user.dir) 解析，{@code classpath:} 前缀从类路径加载。
 * 任何加载失败都会立即抛出 {@link RulesLoadException}，不会静默退化为空规则。
 * </p>
 */
@Slf4j
public final class RulesFileLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";
    public static final Tag PREDICATE_TAG = new Tag("!predicate");

    private RulesFileLoader() {
    }

    public static Map<String, Object> load(String location) {
        if (location == null || location.isBlank()) {
            throw new RulesLoadException("Rules file location is required");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadFromClasspath(location.substring(CLASSPATH_PREFIX.length()), location);
        }
        return load(resolve(location));
    }

    public static Map<String, Object> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RulesLoadException("Rules file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new RulesLoadException("Failed to read rules file: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> load(InputStream inputStream, String source) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new RulesConstructor(options));

        Object root;
        try {
            root = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new RulesLoadException("Failed to parse rules file: " + source, e);
        }
        if (root == null) {
            throw new RulesLoadException("Rules file is empty: " + source);
        }
        if (!(root instanceof Map<?, ?>)) {
            throw new RulesLoadException("Rules file must contain a mapping of service names, got "
                    + root.getClass().getSimpleName() + ": " + source);
        }
        log.info("[LingGate] Access rules loaded from {}", source);
        return (Map<String, Object>) root;
    }

    static Path resolve(String location) {
        Path path = Paths.get(location);
        if (path.isAbsolute()) return path;
        return Paths.get(System.getProperty("user.dir")).resolve(path).normalize();
    }

    private static Map<String, Object> loadFromClasspath(String resource, String location) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = RulesFileLoader.class.getClassLoader();
        }
        InputStream in = cl.getResourceAsStream(name);
        if (in == null) {
            throw new RulesLoadException("Rules file not found: " + location);
        }
        try (in) {
            return load(in, location);
        } catch (IOException e) {
            throw new RulesLoadException("Failed to read rules file: " + location, e);
        }
    }

    /**
     * 在安全构造器基础上增加 {@code !predicate} 标签
     */
    static final class RulesConstructor extends SafeConstructor {

        RulesConstructor(LoaderOptions options) {
            super(options);
            this.yamlConstructors.put(PREDICATE_TAG, new ConstructPredicateReference());
        }

        private final class ConstructPredicateReference extends AbstractConstruct {
            @Override
            public Object construct(Node node) {
                if (!(node instanceof ScalarNode scalar)) {
                    throw new YAMLException("!predicate expects a scalar name:" + node.getStartMark());
                }
                return new PredicateReference(String.valueOf(constructScalar(scalar)));
            }
        }
    }
}
