/**
 * The {@code support} package contains API classes that support the
 * interpreter without requiring any of the run-time objects to exist.
 * <p>
 * Classes {@code public} in this package are accessible to a client
 * application and to the watcher machinery alike.
 */
package uk.co.farowl.vsjw.support;
