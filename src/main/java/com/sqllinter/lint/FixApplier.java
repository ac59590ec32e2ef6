package com.sqllinter.lint;

import com.sqllinter.rule.Fix;
import com.sqllinter.rule.SegmentEdit;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.Segment;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把一组修复应用到语法树上，得到新树；原树不变。
 *
 * <p>编辑按对象身份定位目标段。同一目标有多个编辑时只采用第一个。
 */
public final class FixApplier {

    private FixApplier() {
    }

    public static CompositeSegment apply(CompositeSegment tree, List<Fix> fixes) {
        Map<Segment, Segment> replacements = new IdentityHashMap<>();
        for (Fix fix : fixes) {
            for (SegmentEdit edit : fix.edits()) {
                replacements.putIfAbsent(edit.target(), edit.replacement());
            }
        }
        if (replacements.isEmpty()) {
            return tree;
        }
        return (CompositeSegment) rebuild(tree, replacements);
    }

    private static Segment rebuild(Segment segment, Map<Segment, Segment> replacements) {
        Segment replacement = replacements.get(segment);
        if (replacement != null) {
            return replacement;
        }
        if (!(segment instanceof CompositeSegment composite)) {
            return segment;
        }
        List<Segment> children = new ArrayList<>(composite.children().size());
        boolean changed = false;
        for (Segment child : composite.children()) {
            Segment rebuilt = rebuild(child, replacements);
            changed |= rebuilt != child;
            children.add(rebuilt);
        }
        return changed ? composite.withChildren(children, composite.state()) : composite;
    }
}
