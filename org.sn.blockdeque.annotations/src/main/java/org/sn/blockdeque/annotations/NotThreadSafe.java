package org.sn.blockdeque.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;


/**
 * Marks a class whose instances must be confined to one thread, or guarded by an external lock.
 * Same meaning as javax.annotation.concurrent.NotThreadSafe, kept in this module so the library
 * does not need jsr305 on the module path.
 */
@Documented
@Target({ ElementType.TYPE, ElementType.METHOD })
@Retention(RetentionPolicy.CLASS)
public @interface NotThreadSafe {
}
