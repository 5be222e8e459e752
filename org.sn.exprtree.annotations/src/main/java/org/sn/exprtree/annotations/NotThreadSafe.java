package org.sn.exprtree.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;


/**
 * Instances of the annotated class must be confined to one thread, or guarded by the caller.
 * Same meaning as javax.annotation.concurrent.NotThreadSafe.
 */
@Documented
@Target({ ElementType.TYPE, ElementType.METHOD })
@Retention(RetentionPolicy.CLASS)
public @interface NotThreadSafe {
}
