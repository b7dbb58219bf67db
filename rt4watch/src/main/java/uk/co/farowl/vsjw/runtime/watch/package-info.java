/**
 * The {@code runtime.watch} package lets a client observe changes to
 * {@code dict}, {@code type}, {@code code} and {@code function}
 * objects without altering the code that changes them.
 * <p>
 * Each kind of object has its own table of at most
 * {@link uk.co.farowl.vsjw.runtime.watch.WatcherRegistry#MAX_WATCHERS}
 * watcher slots. A {@code dict} or {@code type} carries a small bit
 * mask recording which slots are interested in it, while {@code code}
 * and {@code function} watchers see every object of their kind. The
 * mutating code calls a dispatch method of the corresponding
 * {@link uk.co.farowl.vsjw.runtime.watch.Watchers} component, in-line,
 * after the change is visible. A watcher that throws is reported
 * through the interpreter's unraisable hook and cannot disturb the
 * operation that notified it.
 */
package uk.co.farowl.vsjw.runtime.watch;
