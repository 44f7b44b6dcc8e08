package com.yupacgo.backend.activity.web;

import com.yupacgo.backend.activity.ActivityDetailsExtractor;
import com.yupacgo.backend.activity.AuditedAction;
import com.yupacgo.backend.activity.service.ActivityEvent;
import com.yupacgo.backend.activity.service.ActivityRecorder;
import com.yupacgo.backend.auth.security.AuthContext;
import com.yupacgo.backend.auth.security.AuthPrincipal;
import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.common.web.ClientInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Post-response observer for {@link AuditedAction} handlers. Looks at the finalized envelope;
 * if it is a success and a principal is attached, captures the entry and hands it to the
 * recorder. The body is always returned untouched, whatever happens in here.
 */
@Slf4j
@RestControllerAdvice
public class ActivityAuditAdvice implements ResponseBodyAdvice<Object> {

    private final ActivityRecorder recorder;
    private final AuthContext auth;
    private final AutowireCapableBeanFactory beans;
    private final Clock clock;
    private final Map<Class<? extends ActivityDetailsExtractor>, ActivityDetailsExtractor> extractors =
            new ConcurrentHashMap<>();

    public ActivityAuditAdvice(ActivityRecorder recorder,
                               AuthContext auth,
                               AutowireCapableBeanFactory beans,
                               Clock clock) {
        this.recorder = recorder;
        this.auth = auth;
        this.beans = beans;
        this.clock = clock;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return returnType.hasMethodAnnotation(AuditedAction.class);
    }

    @Override
    public Object beforeBodyWrite(Object body,
                                  MethodParameter returnType,
                                  MediaType selectedContentType,
                                  Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  ServerHttpRequest request,
                                  ServerHttpResponse response) {

        if (body instanceof ApiResponse<?> envelope
                && envelope.isSuccess()
                && request instanceof ServletServerHttpRequest servletRequest) {

            AuditedAction audited = returnType.getMethodAnnotation(AuditedAction.class);
            try {
                observe(audited, envelope, servletRequest.getServletRequest());
            } catch (RuntimeException e) {
                log.warn("Activity capture failed action={}", audited == null ? null : audited.value(), e);
            }
        }
        return body;
    }

    private void observe(AuditedAction audited, ApiResponse<?> envelope, HttpServletRequest req) {
        if (audited == null) return;

        Optional<AuthPrincipal> principal = auth.currentPrincipal();
        if (principal.isEmpty()) return;

        Map<String, Object> details = extractor(audited.details()).extract(req, envelope);

        recorder.recordAsync(ActivityEvent.of(
                principal.get(),
                audited.value(),
                details,
                ClientInfo.ip(req),
                ClientInfo.userAgent(req),
                clock.instant()
        ));
    }

    private ActivityDetailsExtractor extractor(Class<? extends ActivityDetailsExtractor> type) {
        return extractors.computeIfAbsent(type, t -> resolve(beans, t));
    }

    // registered bean if there is one, else a plain instance
    private static <T extends ActivityDetailsExtractor> T resolve(AutowireCapableBeanFactory beans, Class<T> type) {
        return beans.getBeanProvider(type).getIfAvailable(() -> BeanUtils.instantiateClass(type));
    }
}
