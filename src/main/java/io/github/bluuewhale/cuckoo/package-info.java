/**
 * Striped-lock cuckoo hash set with online resize.
 */
@NullMarked
package io.github.bluuewhale.cuckoo;

import org.jspecify.annotations.NullMarked;
