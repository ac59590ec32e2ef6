package com.sqllinter.rule;

import com.sqllinter.segment.SegmentTypes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 内置规则目录。
 */
public final class StandardRules {
    public static final String KEYWORD_CAPITALISATION = "L010";
    public static final String IDENTIFIER_CAPITALISATION = "L014";

    private StandardRules() {
    }

    /**
     * 关键字大小写一致性，AND/OR 这类关键字运算符也在检查范围内。
     */
    public static Rule keywordCapitalisation(CapitalisationPolicy policy) {
        return new Rule(KEYWORD_CAPITALISATION, "关键字大小写不一致",
                Set.of(SegmentTypes.KEYWORD, "binary_operator"), new CapitalisationEvaluator(policy));
    }

    /**
     * 裸标识符大小写一致性，算法与 L010 相同，只是目标类型不同。
     */
    public static Rule identifierCapitalisation(CapitalisationPolicy policy) {
        return keywordCapitalisation(policy).narrowedTo(IDENTIFIER_CAPITALISATION, "裸标识符大小写不一致",
                Set.of("naked_identifier"));
    }

    public static Map<String, Rule> all(CapitalisationPolicy policy) {
        Map<String, Rule> rules = new LinkedHashMap<>();
        rules.put(KEYWORD_CAPITALISATION, keywordCapitalisation(policy));
        rules.put(IDENTIFIER_CAPITALISATION, identifierCapitalisation(policy));
        return rules;
    }

    /**
     * 按编码挑选规则，保持传入顺序；未知编码抛出 IllegalArgumentException。
     */
    public static List<Rule> select(List<String> codes, CapitalisationPolicy policy) {
        Map<String, Rule> available = all(policy);
        List<Rule> selected = new ArrayList<>();
        for (String code : codes) {
            Rule rule = available.get(code.trim().toUpperCase(Locale.ROOT));
            if (rule == null) {
                throw new IllegalArgumentException("未知规则: " + code + "，可选: " + available.keySet());
            }
            if (!selected.contains(rule)) {
                selected.add(rule);
            }
        }
        return selected;
    }
}
