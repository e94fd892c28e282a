package com.questrail.transducer.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outputs produced by stepping a transducer over a sequence of inputs,
 * together with the transducer left after the last step.
 */
public record RunResult<A, B>(List<B> outputs, Transducer<A, B> last)
{
    public RunResult {
        outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        Objects.requireNonNull(last, "last");
    }
}
