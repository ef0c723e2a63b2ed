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

import org.jspecify.annotations.NonNull;

import java.util.Optional;

/**
 * Contract for loading sensitive data, e.g. signing secrets and SMTP credentials.
 * <p>
 * A mock implementor might read from the filesystem for local development,
 * while a real implementor might pull from a third party service, e.g. AWS Secrets Manager.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface SecretsManager {
	/**
	 * The shared HMAC secret used to sign and verify admin access tokens.
	 */
	@NonNull
	String getAccessTokenSecret();

	/**
	 * Initial password for the bootstrap super admin, only consulted when the admin directory is empty.
	 */
	@NonNull
	String getBootstrapAdminPassword();

	@NonNull
	Optional<String> getSmtpPassword();

	enum Type {
		MOCK,
		REAL
	}
}
