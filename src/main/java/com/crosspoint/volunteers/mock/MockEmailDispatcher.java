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

package com.crosspoint.volunteers.mock;

import com.crosspoint.volunteers.Configuration;
import com.crosspoint.volunteers.util.EmailDispatcher;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link EmailDispatcher} which writes messages to a logger instead of sending them.
 * <p>
 * Every message is also kept in memory so tests can inspect what would have gone out.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockEmailDispatcher implements EmailDispatcher {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final List<SentPasswordReset> sentPasswordResets;
	@NonNull
	private final List<SentVolunteerNotification> sentVolunteerNotifications;
	@NonNull
	private final Logger logger;

	public MockEmailDispatcher(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		this.configuration = configuration;
		this.sentPasswordResets = new CopyOnWriteArrayList<>();
		this.sentVolunteerNotifications = new CopyOnWriteArrayList<>();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	@Override
	public Boolean sendPasswordReset(@NonNull String emailAddress,
																	 @NonNull String passwordResetToken) {
		requireNonNull(emailAddress);
		requireNonNull(passwordResetToken);

		String passwordResetLink = format(getConfiguration().getPasswordResetLinkTemplate(), passwordResetToken);

		// The redacting log converter scrubs the token from the link
		getLogger().info("Mock password reset email to {}: {}", emailAddress, passwordResetLink);
		getSentPasswordResets().add(new SentPasswordReset(emailAddress, passwordResetToken));

		return true;
	}

	@NonNull
	@Override
	public Boolean sendNewVolunteerNotification(@NonNull Set<@NonNull String> recipientEmailAddresses,
																							@NonNull VolunteerSignupSummary volunteerSignupSummary) {
		requireNonNull(recipientEmailAddresses);
		requireNonNull(volunteerSignupSummary);

		getLogger().info("Mock new volunteer notification to {}: {} signed up for {} ministry area[s]", recipientEmailAddresses,
				volunteerSignupSummary.name(), volunteerSignupSummary.ministrySelections().size());
		getSentVolunteerNotifications().add(new SentVolunteerNotification(Set.copyOf(recipientEmailAddresses), volunteerSignupSummary));

		return true;
	}

	@NonNull
	public List<SentPasswordReset> getSentPasswordResets() {
		return this.sentPasswordResets;
	}

	@NonNull
	public List<SentVolunteerNotification> getSentVolunteerNotifications() {
		return this.sentVolunteerNotifications;
	}

	public record SentPasswordReset(
			@NonNull String emailAddress,
			@NonNull String passwordResetToken
	) {
		public SentPasswordReset {
			requireNonNull(emailAddress);
			requireNonNull(passwordResetToken);
		}
	}

	public record SentVolunteerNotification(
			@NonNull Set<@NonNull String> recipientEmailAddresses,
			@NonNull VolunteerSignupSummary volunteerSignupSummary
	) {
		public SentVolunteerNotification {
			requireNonNull(recipientEmailAddresses);
			requireNonNull(volunteerSignupSummary);
		}
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
