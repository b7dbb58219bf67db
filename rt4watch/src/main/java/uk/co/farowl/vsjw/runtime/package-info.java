/**
 * The {@code runtime} package contains the interpreter context and the
 * run-time objects that may be watched: {@code dict}, {@code type},
 * {@code code} and {@code function} objects. Each of these calls a
 * single dispatch entry point in {@link uk.co.farowl.vsjw.runtime.watch}
 * at the moment a watched change, creation or destruction takes place.
 * <p>
 * Classes {@code public} in this package are accessible to a client
 * application.
 */
package uk.co.farowl.vsjw.runtime;
