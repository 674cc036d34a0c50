package com.stellarsql.annotation;

/**
 * A column an unqualified reference can reach, with the frame it belongs
 * to. Columns merged by NATURAL or USING joins have no frame.
 */
record VisibleColumn(Frame frame, FrameColumn column) {

    String rangeName() {
        return frame == null ? null : frame.rangeName();
    }
}
