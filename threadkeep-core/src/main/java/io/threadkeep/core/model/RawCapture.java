package io.threadkeep.core.model;

import java.util.List;

public record RawCapture(String workbookName, List<Fragment> fragments) {
    public static final String UNKNOWN_WORKBOOK = "Unknown";

    public RawCapture {
        workbookName = workbookName == null || workbookName.isBlank() ? UNKNOWN_WORKBOOK : workbookName.trim();
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }
}
