/**
 * The ext API associates typed side-data with instances of
 * {@link io.github.blockir.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * class Person extends ExtHolder { ... }
 *
 * class PersonExts {
 *   public static final Ext<String> NAME = Ext.create(String.class, "name");
 * }
 *
 * Person person = new Person();
 * person.attachExt(NAME, "Jane");
 * person.getExtOrThrow(NAME); // => "Jane"
 * }</pre>
 * <p>
 * The IR uses it for its back-references ({@link io.github.blockir.core.ext.CommonExts}),
 * and passes built on top of the IR can use it to keep per-node scratch data
 * without threading {@link java.util.Map}s around.
 */
package io.github.blockir.core.ext;
