package org.smtbridge.result;

import org.smtbridge.core.NamedSymVar;
import org.smtbridge.sexpr.SExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把模型行里的 s&lt;id&gt; 还原为问题的输入。id 到输入的映射在构造时一次建好。
 */
public final class InputResolver {

    private static final Pattern REFERENCE = Pattern.compile("s([0-9]+)");

    private final Map<Integer, List<NamedSymVar>> byId = new HashMap<>();

    public InputResolver(List<NamedSymVar> inputs) {
        for (NamedSymVar input : inputs) {
            byId.computeIfAbsent(input.getRef().getId(), k -> new ArrayList<>()).add(input);
        }
    }

    /**
     * @param e 符号 s&lt;id&gt;，或以它开头的应用。
     * @param line 原始行，用于报错。
     * @return 唯一匹配的输入；不是输入的引用时为空。
     * @throws AmbiguousInputException 同一 id 对应多个输入时。
     */
    public Optional<NamedSymVar> identify(SExpr e, String line) {
        SExpr head = e.asApp().filter(items -> !items.isEmpty()).map(items -> items.get(0)).orElse(e);
        if (!(head instanceof SExpr.Symbol symbol)) {
            return Optional.empty();
        }
        Matcher m = REFERENCE.matcher(symbol.getName());
        if (!m.matches()) {
            return Optional.empty();
        }
        int id;
        try {
            id = Integer.parseInt(m.group(1));
        } catch (NumberFormatException ex) {
            // 超出 int 的 id 不可能是输入
            return Optional.empty();
        }
        List<NamedSymVar> matches = byId.getOrDefault(id, List.of());
        if (matches.size() > 1) {
            throw new AmbiguousInputException(symbol.getName(), matches, line);
        }
        return matches.stream().findFirst();
    }
}
