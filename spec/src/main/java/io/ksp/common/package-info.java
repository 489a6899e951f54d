@NullMarked
package io.ksp.common;

import org.jspecify.annotations.NullMarked;
