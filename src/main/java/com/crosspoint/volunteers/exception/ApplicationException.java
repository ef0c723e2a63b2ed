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

package com.crosspoint.volunteers.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A failure the caller can act on: an HTTP-style status code plus human-readable general and per-field errors.
 * <p>
 * Messages are expected to be localized already, since they are shown to callers as-is.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ApplicationException extends RuntimeException {
	public static final int STATUS_CODE_UNAUTHORIZED = 401;
	public static final int STATUS_CODE_FORBIDDEN = 403;
	public static final int STATUS_CODE_CONFLICT = 409;
	public static final int STATUS_CODE_UNPROCESSABLE_CONTENT = 422;

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final List<@NonNull String> generalErrors;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	@NonNull
	public static Builder withStatusCodeAndGeneralError(@NonNull Integer statusCode,
																											@NonNull String generalError) {
		requireNonNull(generalError);
		return withStatusCode(statusCode).generalError(generalError);
	}

	@NonNull
	public static Builder withStatusCodeAndFieldError(@NonNull Integer statusCode,
																										@NonNull String field,
																										@NonNull String fieldError) {
		ErrorCollector errorCollector = new ErrorCollector();
		errorCollector.addFieldError(field, fieldError);

		return withStatusCode(statusCode).fieldErrors(errorCollector.fieldErrors);
	}

	private ApplicationException(@NonNull String message,
															 @NonNull Builder builder) {
		super(requireNonNull(message));
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.generalErrors = builder.generalErrors == null ? List.of() : List.copyOf(builder.generalErrors);
		this.fieldErrors = builder.fieldErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldErrors));
	}

	/**
	 * Accumulates field validation failures so a caller sees every problem with its input at once.
	 */
	@NotThreadSafe
	public static class ErrorCollector {
		@NonNull
		private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

		public ErrorCollector() {
			this.fieldErrors = new LinkedHashMap<>();
		}

		public void addFieldError(@NonNull String field,
															@NonNull String error) {
			requireNonNull(field);
			requireNonNull(error);

			List<@NonNull String> errors = this.fieldErrors.computeIfAbsent(field, ignored -> new ArrayList<>(2));

			if (!errors.contains(error))
				errors.add(error);
		}

		/**
		 * Throws a 422 carrying every field error collected so far, if there are any.
		 */
		public void throwIfErrors() {
			if (this.fieldErrors.size() > 0)
				throw withStatusCode(STATUS_CODE_UNPROCESSABLE_CONTENT).fieldErrors(this.fieldErrors).build();
		}
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Integer statusCode;
		@Nullable
		private List<@NonNull String> generalErrors;
		@Nullable
		private Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

		private Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Builder generalError(@Nullable String generalError) {
			this.generalErrors = generalError == null ? null : List.of(generalError);
			return this;
		}

		@NonNull
		public Builder fieldErrors(@Nullable Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors) {
			this.fieldErrors = fieldErrors;
			return this;
		}

		@NonNull
		public ApplicationException build() {
			StringJoiner message = new StringJoiner(", ");
			message.add(format("Status %d", this.statusCode));

			if (this.generalErrors != null)
				message.add(format("General Errors: %s", this.generalErrors));

			if (this.fieldErrors != null && this.fieldErrors.size() > 0)
				message.add(format("Field Errors: %s", this.fieldErrors));

			return new ApplicationException(message.toString(), this);
		}
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public List<@NonNull String> getGeneralErrors() {
		return this.generalErrors;
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getFieldErrors() {
		return this.fieldErrors;
	}
}
