package com.sqllinter.grammar;

import com.sqllinter.segment.RawSegment;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 用正则整体匹配词法单元的大写形式，可附加排除模板（如保留字）。
 */
public final class RegexMatcher extends TerminalGrammar<RegexMatcher> {
    private final Pattern template;
    private final Pattern antiTemplate;

    private RegexMatcher(String template, String antiTemplate, String type, String name) {
        super(type, name);
        this.template = Pattern.compile(template);
        this.antiTemplate = antiTemplate == null ? null : Pattern.compile(antiTemplate);
    }

    private RegexMatcher(RegexMatcher other) {
        super(other);
        this.template = other.template;
        this.antiTemplate = other.antiTemplate;
    }

    public static RegexMatcher of(String template, String type, String name) {
        return new RegexMatcher(template, null, type, name);
    }

    public static RegexMatcher of(String template, String antiTemplate, String type, String name) {
        return new RegexMatcher(template, antiTemplate, type, name);
    }

    @Override
    protected RegexMatcher copy() {
        return new RegexMatcher(this);
    }

    @Override
    protected boolean accepts(RawSegment segment) {
        if (!segment.isCode()) {
            return false;
        }
        String upper = segment.raw().toUpperCase(Locale.ROOT);
        if (!template.matcher(upper).matches()) {
            return false;
        }
        return antiTemplate == null || !antiTemplate.matcher(upper).matches();
    }

    @Override
    public String describe() {
        return "/" + template.pattern() + "/";
    }
}
