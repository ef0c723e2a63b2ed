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

package com.crosspoint.volunteers;

import com.crosspoint.volunteers.model.db.AdminAccount;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.MDC;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of context: which admin/time zone/locale/etc. is applied to the current thread of execution?
 * <p>
 * Contexts nest. {@link #run(Supplier)} binds this context for the duration of the call and restores whatever
 * was bound before, including the logging MDC.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CurrentContext {
	@NonNull
	private static final ThreadLocal<CurrentContext> CURRENT_CONTEXT_HOLDER;
	@NonNull
	private static final String LOGGING_KEY;

	static {
		CURRENT_CONTEXT_HOLDER = new ThreadLocal<>();
		LOGGING_KEY = "CURRENT_CONTEXT";
	}

	@NonNull
	public static CurrentContext get() {
		return find().orElseThrow(() ->
				new IllegalStateException(format("No %s is bound to the current thread", CurrentContext.class.getSimpleName())));
	}

	@NonNull
	public static Optional<CurrentContext> find() {
		return Optional.ofNullable(CURRENT_CONTEXT_HOLDER.get());
	}

	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Locale locale;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private AdminAccount adminAccount;

		private Builder() {}

		@NonNull
		public Builder locale(@Nullable Locale locale) {
			this.locale = locale;
			return this;
		}

		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder adminAccount(@Nullable AdminAccount adminAccount) {
			this.adminAccount = adminAccount;
			return this;
		}

		@NonNull
		public CurrentContext build() {
			return new CurrentContext(this);
		}
	}

	@NonNull
	public static Builder with(@Nullable Locale locale,
														 @Nullable ZoneId timeZone) {
		return new Builder().locale(locale).timeZone(timeZone);
	}

	@NonNull
	public static Builder withAdminAccount(@Nullable AdminAccount adminAccount) {
		return new Builder().adminAccount(adminAccount);
	}

	@NonNull
	private final Locale locale;
	@NonNull
	private final ZoneId timeZone;
	@Nullable
	private final AdminAccount adminAccount;

	private CurrentContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.timeZone = builder.timeZone == null ? Configuration.getDefaultTimeZone() : builder.timeZone;
		this.locale = builder.locale == null ? Configuration.getDefaultLocale() : builder.locale;
		this.adminAccount = builder.adminAccount;
	}

	public void run(@NonNull Runnable runnable) {
		requireNonNull(runnable);
		run(() -> {
			runnable.run();
			return null;
		});
	}

	@Nullable
	public <T> T run(@NonNull Supplier<T> supplier) {
		requireNonNull(supplier);

		CurrentContext previousContext = CURRENT_CONTEXT_HOLDER.get();
		String previousMdc = MDC.get(LOGGING_KEY);

		CURRENT_CONTEXT_HOLDER.set(this);
		MDC.put(LOGGING_KEY, determineLoggingDescription());

		try {
			return supplier.get();
		} finally {
			// Restore previous context (or clear if we were at the root)
			if (previousContext != null)
				CURRENT_CONTEXT_HOLDER.set(previousContext);
			else
				CURRENT_CONTEXT_HOLDER.remove();

			if (previousMdc != null)
				MDC.put(LOGGING_KEY, previousMdc);
			else
				MDC.remove(LOGGING_KEY);
		}
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", format("%s{", CurrentContext.class.getSimpleName()), "}");

		getAdminAccount().ifPresent(adminAccount -> joiner.add(format("adminAccountId=%s", adminAccount.adminAccountId())));

		joiner.add(format("locale=%s", getLocale().toLanguageTag()));
		joiner.add(format("timeZone=%s", getTimeZone().getId()));

		return joiner.toString();
	}

	@NonNull
	public Optional<AdminAccount> getAdminAccount() {
		return Optional.ofNullable(this.adminAccount);
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	public Locale getLocale() {
		return this.locale;
	}

	@NonNull
	private String determineLoggingDescription() {
		AdminAccount adminAccount = getAdminAccount().orElse(null);
		return adminAccount == null ? "unauthenticated" : format("admin %d", adminAccount.adminAccountId());
	}
}
