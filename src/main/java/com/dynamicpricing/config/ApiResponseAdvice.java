package com.dynamicpricing.config;

import com.dynamicpricing.api.controller.PricingController;
import com.dynamicpricing.api.dto.response.ApiErrorResponse;
import com.dynamicpricing.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps the bodies of the pricing, scenario and health controllers in {@link ApiResponse}.
 *
 * <p>Scoped to the controller package, so actuator and Boot's error controller keep their
 * own shape. Bodies written by {@code GlobalExceptionHandler} are already envelopes.
 */
@RestControllerAdvice(basePackageClasses = PricingController.class)
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // A String body would have to be written as an envelope by the String converter
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        return ApiResponse.of(body);
    }
}
