package io.strata.core.memory;

public record SweepReport(
    String ownerId,
    int expiredFromHot,
    int promotedToWarm,
    int archivedFromHot,
    int dropped,
    int demotedFromWarm
) {

    public int moved() {
        return promotedToWarm + archivedFromHot + demotedFromWarm;
    }
}
