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

package com.crosspoint.volunteers.util;

import com.crosspoint.volunteers.Configuration;
import com.crosspoint.volunteers.Configuration.SmtpSettings;
import com.crosspoint.volunteers.model.ministry.MinistrySelection;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.Set;
import java.util.StringJoiner;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link EmailDispatcher} which delivers plain-text messages over SMTP with STARTTLS.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SmtpEmailDispatcher implements EmailDispatcher {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final SmtpSettings smtpSettings;
	@Nullable
	private final String smtpPassword;
	@NonNull
	private final Session session;
	@NonNull
	private final Logger logger;

	public SmtpEmailDispatcher(@NonNull Configuration configuration,
														 @NonNull SecretsManager secretsManager) {
		requireNonNull(configuration);
		requireNonNull(secretsManager);

		this.configuration = configuration;
		this.smtpSettings = configuration.getSmtpSettings().orElseThrow(() ->
				new IllegalStateException(format("SMTP settings are required when using %s", SmtpEmailDispatcher.class.getSimpleName())));
		this.smtpPassword = secretsManager.getSmtpPassword().orElse(null);
		this.session = Session.getInstance(createSessionProperties(this.smtpSettings, this.smtpPassword != null));
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	@Override
	public Boolean sendPasswordReset(@NonNull String emailAddress,
																	 @NonNull String passwordResetToken) {
		requireNonNull(emailAddress);
		requireNonNull(passwordResetToken);

		String passwordResetLink = format(getConfiguration().getPasswordResetLinkTemplate(), passwordResetToken);
		long validForMinutes = getConfiguration().getPasswordResetExpiration().toMinutes();

		String body = format("""
				Password Reset Request

				You requested a password reset for the volunteer app admin dashboard.

				Use the link below to set a new password (valid for %d minutes):
				%s

				If you did not request this, please ignore this email.
				""", validForMinutes, passwordResetLink);

		return send(Set.of(emailAddress), "Password Reset", body);
	}

	@NonNull
	@Override
	public Boolean sendNewVolunteerNotification(@NonNull Set<@NonNull String> recipientEmailAddresses,
																							@NonNull VolunteerSignupSummary volunteerSignupSummary) {
		requireNonNull(recipientEmailAddresses);
		requireNonNull(volunteerSignupSummary);

		StringJoiner ministryLines = new StringJoiner("\n");

		for (MinistrySelection ministrySelection : volunteerSignupSummary.ministrySelections())
			ministryLines.add(format("- %s: %s", ministrySelection.category(), ministrySelection.area()));

		String body = format("""
				A new volunteer has signed up.

				Name: %s
				Phone: %s
				Email: %s

				Ministry interests:
				%s
				""", volunteerSignupSummary.name(), volunteerSignupSummary.phoneNumber(), volunteerSignupSummary.emailAddress(),
				ministryLines.length() == 0 ? "(none selected)" : ministryLines.toString());

		return send(recipientEmailAddresses, format("New Volunteer Signup: %s", volunteerSignupSummary.name()), body);
	}

	@NonNull
	private Boolean send(@NonNull Set<@NonNull String> recipientEmailAddresses,
											 @NonNull String subject,
											 @NonNull String body) {
		requireNonNull(recipientEmailAddresses);
		requireNonNull(subject);
		requireNonNull(body);

		getLogger().debug("Sending email '{}' to {}", subject, recipientEmailAddresses);

		try {
			MimeMessage message = new MimeMessage(getSession());
			message.setFrom(new InternetAddress(getSmtpSettings().fromEmailAddress()));

			for (String recipientEmailAddress : recipientEmailAddresses)
				message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipientEmailAddress));

			message.setSubject(subject, StandardCharsets.UTF_8.name());
			message.setText(body, StandardCharsets.UTF_8.name());

			if (getSmtpPassword() == null)
				Transport.send(message);
			else
				Transport.send(message, getSmtpSettings().username(), getSmtpPassword());

			getLogger().info("Sent email '{}' to {}", subject, recipientEmailAddresses);
			return true;
		} catch (MessagingException | RuntimeException e) {
			getLogger().error(format("Unable to send email '%s' to %s", subject, recipientEmailAddresses), e);
			return false;
		}
	}

	@NonNull
	private static Properties createSessionProperties(@NonNull SmtpSettings smtpSettings,
																										boolean authenticate) {
		requireNonNull(smtpSettings);

		Properties properties = new Properties();
		properties.put("mail.smtp.host", smtpSettings.host());
		properties.put("mail.smtp.port", String.valueOf(smtpSettings.port()));
		properties.put("mail.smtp.auth", String.valueOf(authenticate));
		properties.put("mail.smtp.starttls.enable", String.valueOf(smtpSettings.startTls()));
		properties.put("mail.smtp.connectiontimeout", "10000");
		properties.put("mail.smtp.timeout", "10000");

		return properties;
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private SmtpSettings getSmtpSettings() {
		return this.smtpSettings;
	}

	@Nullable
	private String getSmtpPassword() {
		return this.smtpPassword;
	}

	@NonNull
	private Session getSession() {
		return this.session;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
