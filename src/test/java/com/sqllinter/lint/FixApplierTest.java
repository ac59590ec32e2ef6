package com.sqllinter.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.sqllinter.dialect.Dialects;
import com.sqllinter.parser.Parser;
import com.sqllinter.rule.Fix;
import com.sqllinter.segment.CompositeSegment;
import com.sqllinter.segment.RawSegment;
import com.sqllinter.segment.Segment;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FixApplierTest {
    private final Parser parser = new Parser(Dialects.get("ansi"));

    @Test
    void testReplaceSingleToken() {
        CompositeSegment tree = parser.parse("select a from t;\nselect b from u;").tree();
        RawSegment from = keyword(tree, 0, "from");

        CompositeSegment fixed = FixApplier.apply(tree, List.of(Fix.replace(from, from.withRaw("FROM"))));

        assertEquals("select a FROM t;\nselect b from u;", fixed.raw());
        assertEquals("select a from t;\nselect b from u;", tree.raw());
    }

    @Test
    void testUntouchedSubtreesAreShared() {
        CompositeSegment tree = parser.parse("select a from t;\nselect b from u;").tree();
        RawSegment from = keyword(tree, 0, "from");

        CompositeSegment fixed = FixApplier.apply(tree, List.of(Fix.replace(from, from.withRaw("FROM"))));

        List<Segment> before = tree.recursiveCrawl(Set.of("statement"));
        List<Segment> after = fixed.recursiveCrawl(Set.of("statement"));
        assertSame(before.get(1), after.get(1));
        assertEquals(CompositeSegment.State.PARSED, fixed.state());
    }

    @Test
    void testFirstEditForSameTargetWins() {
        CompositeSegment tree = parser.parse("select a").tree();
        RawSegment select = keyword(tree, 0, "select");

        CompositeSegment fixed = FixApplier.apply(tree, List.of(
                Fix.replace(select, select.withRaw("SELECT")),
                Fix.replace(select, select.withRaw("Select"))));

        assertEquals("SELECT a", fixed.raw());
    }

    @Test
    void testNoFixesReturnsSameTree() {
        CompositeSegment tree = parser.parse("select a").tree();

        assertSame(tree, FixApplier.apply(tree, List.of()));
    }

    private static RawSegment keyword(CompositeSegment tree, int occurrence, String word) {
        List<RawSegment> matches = tree.recursiveCrawl(Set.of("keyword")).stream()
                .filter(segment -> segment.raw().equalsIgnoreCase(word))
                .map(RawSegment.class::cast)
                .toList();
        return matches.get(occurrence);
    }
}
