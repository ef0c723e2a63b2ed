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

import ch.qos.logback.classic.pattern.MessageConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Logback converter that keeps credentials out of log output.
 * <p>
 * Two kinds of values are redacted:
 * <ul>
 *   <li>JWT access tokens, recognized by their {@code eyJ...eyJ...signature} shape</li>
 *   <li>password reset tokens carried in a {@code reset_token=} query parameter</li>
 * </ul>
 * <p>
 * Usage in logback.xml:
 * <pre>{@code
 * <conversionRule conversionWord="msg" converterClass="com.crosspoint.volunteers.util.LoggingRedactor"/>
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactor extends MessageConverter {
	@NonNull
	private static final Pattern JWT_PATTERN;
	@NonNull
	private static final Pattern PASSWORD_RESET_TOKEN_PATTERN;
	@NonNull
	private static final String REDACTED;

	static {
		// eyJ = base64url encoding of '{"' which all JWT headers/payloads begin with
		JWT_PATTERN = Pattern.compile("eyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]+");
		PASSWORD_RESET_TOKEN_PATTERN = Pattern.compile("(reset_token=)[A-Za-z0-9_-]+");
		REDACTED = "[REDACTED]";
	}

	@Override
	public String convert(ILoggingEvent event) {
		return redact(super.convert(event));
	}

	@NonNull
	public static String redact(@NonNull String message) {
		String redacted = JWT_PATTERN.matcher(message).replaceAll(REDACTED);
		return PASSWORD_RESET_TOKEN_PATTERN.matcher(redacted).replaceAll("$1" + REDACTED);
	}
}
