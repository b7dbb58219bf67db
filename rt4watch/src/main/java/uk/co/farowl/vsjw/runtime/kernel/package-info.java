/**
 * The {@code runtime.kernel} package contains internal parts of the
 * type machinery: method resolution order, the attribute cache keyed by
 * type version tag, and the source of object identities.
 * <p>
 * Classes {@code public} in this package are accessible across the
 * project, but are not intended for client programs.
 */
package uk.co.farowl.vsjw.runtime.kernel;
