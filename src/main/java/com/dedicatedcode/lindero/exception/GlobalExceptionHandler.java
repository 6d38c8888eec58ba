/*
 *  This file is part of lindero.
 *
 *  Lindero is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Lindero is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Lindero. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.lindero.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FeatureProcessingException.class)
    public ResponseEntity<ErrorResponse> handleFeatureProcessing(FeatureProcessingException ex, WebRequest request) {
        logger.warn("Rejected collection: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Feature Processing Failed", ex.getMessage(), request);
    }

    @ExceptionHandler({MalformedGeometryException.class, MissingRequiredPropertyException.class})
    public ResponseEntity<ErrorResponse> handleInvalidFeature(SimplificationException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Feature", ex.getMessage(), request);
    }

    @ExceptionHandler(SimplificationException.class)
    public ResponseEntity<ErrorResponse> handleSimplification(SimplificationException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Feature Collection", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Unreadable Request Body", "Request body is not valid GeoJSON", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, WebRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), error, message,
                                               request.getDescription(false).replace("uri=", ""));
        return new ResponseEntity<>(body, status);
    }
}
