package com.yupacgo.backend.activity;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler whose successful, authenticated responses produce an activity log entry.
 * Picked up by {@link com.yupacgo.backend.activity.web.ActivityAuditAdvice}.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface AuditedAction {

    /** action tag, see {@link ActivityAction} */
    String value();

    Class<? extends ActivityDetailsExtractor> details() default ActivityDetailsExtractor.None.class;
}
