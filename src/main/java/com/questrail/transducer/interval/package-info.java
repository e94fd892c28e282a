/**
 * On/off intervals over transducer outputs, represented as
 * {@link java.util.Optional}, and the {@code gate} combinator that freezes an
 * inner transducer while its input interval is off.
 */
package com.questrail.transducer.interval;
