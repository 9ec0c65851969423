package de.alive.inboxscan.unsubscribe;

import de.alive.inboxscan.domain.UnsubscribeOutcome;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface UnsubscribeOutcomeLog {

    void append(@NotNull UnsubscribeOutcome outcome);

    @NotNull List<UnsubscribeOutcome> entries();
}
