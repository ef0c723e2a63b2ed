/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.crosspoint.volunteers.model.api.response;

import com.crosspoint.volunteers.exception.ApplicationException;
import com.crosspoint.volunteers.exception.AuthenticationException;
import com.crosspoint.volunteers.exception.AuthorizationException;
import com.crosspoint.volunteers.exception.NotFoundException;
import com.lokalized.Strings;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an exception that bubbled out of the system.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ErrorResponse {
	@NonNull
	private static final Logger LOGGER;

	static {
		LOGGER = LoggerFactory.getLogger(ErrorResponse.class);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String summary;
	@NonNull
	private final List<String> generalErrors;
	@NonNull
	private final Map<String, List<String>> fieldErrors;

	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	/**
	 * Maps any throwable to a client-safe error body.
	 * <p>
	 * Authentication failures always carry the same message so callers cannot learn why a token or
	 * login was rejected. Anything unexpected becomes a 500 with a generic message and is logged.
	 */
	@NonNull
	public static ErrorResponse fromThrowable(@NonNull Throwable throwable,
																						@NonNull Strings strings) {
		requireNonNull(throwable);
		requireNonNull(strings);

		int statusCode;
		List<String> generalErrors = new ArrayList<>();
		Map<String, List<String>> fieldErrors = new LinkedHashMap<>();

		if (throwable instanceof AuthenticationException) {
			statusCode = 401;
			generalErrors.add(strings.get("You must be authenticated to perform this action."));
		} else if (throwable instanceof AuthorizationException) {
			statusCode = 403;
			generalErrors.add(strings.get("You are not authorized to perform this action."));
		} else if (throwable instanceof NotFoundException) {
			statusCode = 404;
			generalErrors.add(strings.get("The resource you requested was not found."));
		} else if (throwable instanceof ApplicationException applicationException) {
			statusCode = applicationException.getStatusCode();
			generalErrors.addAll(applicationException.getGeneralErrors());
			fieldErrors.putAll(applicationException.getFieldErrors());
		} else {
			LOGGER.error("Unexpected error", throwable);
			statusCode = 500;
			generalErrors.add(strings.get("An unexpected error occurred."));
		}

		// Combine all the error messages into one field for easy access by clients
		Set<String> summaryComponents = new LinkedHashSet<>(generalErrors);

		for (List<String> fieldErrorValues : fieldErrors.values())
			summaryComponents.addAll(fieldErrorValues);

		StringJoiner summary = new StringJoiner(" ");
		summaryComponents.forEach(summary::add);

		return withStatusCode(statusCode)
				.summary(summary.length() == 0 ? strings.get("An unexpected error occurred.") : summary.toString())
				.generalErrors(generalErrors)
				.fieldErrors(fieldErrors)
				.build();
	}

	private ErrorResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = requireNonNull(builder.statusCode);
		this.summary = requireNonNull(builder.summary);
		this.generalErrors = builder.generalErrors == null ? List.of() : Collections.unmodifiableList(builder.generalErrors);
		this.fieldErrors = builder.fieldErrors == null ? Map.of() : Collections.unmodifiableMap(builder.fieldErrors);
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Integer statusCode;
		@Nullable
		private String summary;
		@Nullable
		private List<String> generalErrors;
		@Nullable
		private Map<String, List<String>> fieldErrors;

		private Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder summary(@NonNull String summary) {
			requireNonNull(summary);
			this.summary = summary;
			return this;
		}

		@NonNull
		public Builder generalErrors(@Nullable List<String> generalErrors) {
			this.generalErrors = generalErrors;
			return this;
		}

		@NonNull
		public Builder fieldErrors(@Nullable Map<String, List<String>> fieldErrors) {
			this.fieldErrors = fieldErrors;
			return this;
		}

		@NonNull
		public ErrorResponse build() {
			return new ErrorResponse(this);
		}
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getSummary() {
		return this.summary;
	}

	@NonNull
	public List<String> getGeneralErrors() {
		return this.generalErrors;
	}

	@NonNull
	public Map<String, List<String>> getFieldErrors() {
		return this.fieldErrors;
	}
}
