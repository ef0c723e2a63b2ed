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

import com.crosspoint.volunteers.Configuration.CustomMinistryAreaSeed;
import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import com.crosspoint.volunteers.service.AdminAccountService;
import com.crosspoint.volunteers.util.SecretsManager;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.pyranid.Database;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	public static void main(String[] args) {
		String environment = System.getenv("VOLUNTEER_APP_ENVIRONMENT");

		if (environment == null)
			throw new IllegalArgumentException("You must specify the VOLUNTEER_APP_ENVIRONMENT environment variable");

		App app = new App(new Configuration(environment));
		MinistryTaxonomy ministryTaxonomy = app.getInjector().getInstance(MinistryTaxonomy.class);

		app.getLogger().info("Volunteer app initialized in {} environment with {} ministry categories",
				app.getConfiguration().getEnvironment(), ministryTaxonomy.getCategories().size());
	}

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a controllable clock
		Module module = new AppModule(configuration);

		if (testingModules != null && testingModules.length > 0)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		initializeDatabase();
		bootstrapAdminDirectory();

		// Taxonomy is a snapshot, so take it only once custom areas are in place
		getInjector().getInstance(MinistryTaxonomy.class);
	}

	// A real system would keep its table creates/DDL in files outside of Java code
	protected void initializeDatabase() {
		Database database = getInjector().getInstance(Database.class);

		database.execute("CREATE SEQUENCE admin_account_seq AS BIGINT START WITH 1");
		database.execute("CREATE SEQUENCE volunteer_seq AS BIGINT START WITH 1");
		database.execute("CREATE SEQUENCE volunteer_ministry_seq AS BIGINT START WITH 1");
		database.execute("CREATE SEQUENCE volunteer_note_seq AS BIGINT START WITH 1");
		database.execute("CREATE SEQUENCE custom_ministry_area_seq AS BIGINT START WITH 1");

		// Email addresses are lower-cased before they get here, so a plain unique constraint is case-insensitive
		database.execute("""
				CREATE TABLE admin_account (
					admin_account_id BIGINT PRIMARY KEY,
					email_address VARCHAR(320) NOT NULL,
					password_hash VARCHAR(1024) NOT NULL,
					name VARCHAR(1024),
					active BOOLEAN DEFAULT TRUE NOT NULL,
					super_admin BOOLEAN DEFAULT FALSE NOT NULL,
					password_reset_token VARCHAR(255),
					password_reset_expires_at TIMESTAMP,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT admin_account_email_address_unique_idx UNIQUE(email_address),
					CONSTRAINT admin_account_password_reset_paired_chk CHECK (
						(password_reset_token IS NULL AND password_reset_expires_at IS NULL)
						OR (password_reset_token IS NOT NULL AND password_reset_expires_at IS NOT NULL)
					)
				)
				""");

		database.execute("""
				CREATE TABLE volunteer (
					volunteer_id BIGINT PRIMARY KEY,
					name VARCHAR(1024) NOT NULL,
					phone_number VARCHAR(64) NOT NULL,
					email_address VARCHAR(320) NOT NULL,
					signup_date DATE NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					updated_at TIMESTAMP DEFAULT NOW() NOT NULL
				)
				""");

		database.execute("""
				CREATE TABLE volunteer_ministry (
					volunteer_ministry_id BIGINT PRIMARY KEY,
					volunteer_id BIGINT NOT NULL REFERENCES volunteer ON DELETE CASCADE,
					ministry_category VARCHAR(255) NOT NULL,
					ministry_area VARCHAR(255) NOT NULL
				)
				""");

		database.execute("""
				CREATE TABLE volunteer_note (
					volunteer_note_id BIGINT PRIMARY KEY,
					volunteer_id BIGINT NOT NULL REFERENCES volunteer ON DELETE CASCADE,
					admin_account_id BIGINT REFERENCES admin_account,
					note_text VARCHAR(2000) NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL
				)
				""");

		database.execute("""
				CREATE TABLE custom_ministry_area (
					custom_ministry_area_id BIGINT PRIMARY KEY,
					ministry_category VARCHAR(255) NOT NULL,
					ministry_area VARCHAR(255) NOT NULL,
					CONSTRAINT custom_ministry_area_unique_idx UNIQUE(ministry_category, ministry_area)
				)
				""");

		List<CustomMinistryAreaSeed> customMinistryAreaSeeds = getConfiguration().getCustomMinistryAreaSeeds();

		if (customMinistryAreaSeeds.size() > 0) {
			List<List<Object>> parameterGroups = new ArrayList<>(customMinistryAreaSeeds.size());

			for (CustomMinistryAreaSeed customMinistryAreaSeed : customMinistryAreaSeeds) {
				Long customMinistryAreaId = database.queryForObject("CALL NEXT VALUE FOR custom_ministry_area_seq", Long.class).get();
				parameterGroups.add(List.of(customMinistryAreaId, customMinistryAreaSeed.category(), customMinistryAreaSeed.area()));
			}

			database.executeBatch("""
					INSERT INTO custom_ministry_area (
						custom_ministry_area_id,
						ministry_category,
						ministry_area
					) VALUES (?,?,?)
					""", parameterGroups);
		}
	}

	protected void bootstrapAdminDirectory() {
		Database database = getInjector().getInstance(Database.class);
		AdminAccountService adminAccountService = getInjector().getInstance(AdminAccountService.class);
		SecretsManager secretsManager = getInjector().getInstance(SecretsManager.class);

		database.transaction(() -> {
			if (adminAccountService.countAdminAccounts() == 0)
				adminAccountService.createBootstrapSuperAdmin(secretsManager.getBootstrapAdminPassword());

			// Nothing recovers from this automatically; someone has to fix the data by hand
			if (adminAccountService.countActiveSuperAdmins() == 0)
				getLogger().warn("There is no active super admin account. Admin creation and role transfer are unavailable.");

			return Optional.empty();
		});
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
