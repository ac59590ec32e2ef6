package com.sqllinter.grammar;

import com.sqllinter.segment.FilePosition;
import com.sqllinter.segment.MetaSegment;
import com.sqllinter.segment.Segment;
import com.sqllinter.segment.SegmentTypes;

import java.util.List;

/**
 * 缩进/反缩进标记：不消费输入，在序列中原位插入零宽段。
 */
public enum Meta implements Grammar {
    INDENT,
    DEDENT;

    MetaSegment create(FilePosition position) {
        return this == INDENT ? MetaSegment.indent(position) : MetaSegment.dedent(position);
    }

    @Override
    public MatchResult match(List<Segment> segments, ParseContext context) {
        FilePosition position = segments.isEmpty() ? FilePosition.START : segments.get(0).position();
        return MatchResult.of(List.of(create(position)), segments);
    }

    @Override
    public boolean isOptional() {
        return true;
    }

    @Override
    public String describe() {
        return this == INDENT ? SegmentTypes.INDENT : SegmentTypes.DEDENT;
    }
}
