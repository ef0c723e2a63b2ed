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

import com.crosspoint.volunteers.mock.MockEmailDispatcher;
import com.crosspoint.volunteers.mock.MockSecretsManager;
import com.crosspoint.volunteers.model.api.response.AdminAccountResponse.AdminAccountResponseFactory;
import com.crosspoint.volunteers.model.api.response.VolunteerResponse.VolunteerResponseFactory;
import com.crosspoint.volunteers.model.db.CustomMinistryArea;
import com.crosspoint.volunteers.model.ministry.MinistryTaxonomy;
import com.crosspoint.volunteers.util.EmailDispatcher;
import com.crosspoint.volunteers.util.PasswordManager;
import com.crosspoint.volunteers.util.SecretsManager;
import com.crosspoint.volunteers.util.SmtpEmailDispatcher;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.lokalized.DefaultStrings;
import com.lokalized.LocalizedStringLoader;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.DefaultInstanceProvider;
import com.pyranid.DefaultStatementLogger;
import com.pyranid.StatementContext;
import com.pyranid.StatementLog;
import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@NonNull
	private final Configuration configuration;

	public AppModule(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@Override
	protected void configure() {
		install(new FactoryModuleBuilder().build(AdminAccountResponseFactory.class));
		install(new FactoryModuleBuilder().build(VolunteerResponseFactory.class));
	}

	@NonNull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@NonNull
	@Provides
	public CurrentContext provideCurrentContext() {
		return CurrentContext.get();
	}

	@NonNull
	@Provides
	@Singleton
	public Database provideDatabase(@NonNull Injector injector) {
		requireNonNull(injector);

		// Each App instance gets its own isolated in-memory database so tests can run in parallel in one JVM
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return Database.forDataSource(dataSource)
				// Use Google Guice when Pyranid needs to vend instances
				.instanceProvider(new DefaultInstanceProvider() {
					@Override
					@NonNull
					public <T> T provide(@NonNull StatementContext<T> statementContext,
															 @NonNull Class<T> instanceType) {
						return injector.getInstance(instanceType);
					}
				})
				.statementLogger(new DefaultStatementLogger() {
					@NonNull
					private final Logger logger = LoggerFactory.getLogger("com.crosspoint.volunteers.StatementLogger");

					@Override
					public void log(@NonNull StatementLog statementLog) {
						if (logger.isTraceEnabled())
							logger.trace("SQL took {}ms:\n{}\nParameters: {}", format("%.2f", statementLog.getTotalDuration().toNanos() / 1000000.0),
									statementLog.getStatementContext().getStatement().getSql().stripIndent().trim(),
									statementLog.getStatementContext().getParameters());
					}
				})
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public Strings provideStrings() {
		String defaultLanguageCode = Configuration.getDefaultLocale().getLanguage();

		return new DefaultStrings.Builder(defaultLanguageCode,
				() -> LocalizedStringLoader.loadFromFilesystem(Paths.get("src/main/resources/strings")))
				// Strings are also needed outside of any bound context, e.g. during startup
				.localeSupplier(() -> CurrentContext.find().map(CurrentContext::getLocale).orElse(Configuration.getDefaultLocale()))
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public PasswordManager providePasswordManager() {
		return PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512")
				.iterations(210_000)
				.saltLength(64)
				.keyLength(512)
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public Clock provideClock() {
		return Clock.systemUTC();
	}

	@NonNull
	@Provides
	@Singleton
	public MinistryTaxonomy provideMinistryTaxonomy(@NonNull Database database) {
		requireNonNull(database);

		List<CustomMinistryArea> customMinistryAreas = database.queryForList("""
				SELECT *
				FROM custom_ministry_area
				ORDER BY custom_ministry_area_id
				""", CustomMinistryArea.class);

		return MinistryTaxonomy.builtIn().withCustomMinistryAreas(customMinistryAreas);
	}

	@NonNull
	@Provides
	@Singleton
	public SecretsManager provideSecretsManager(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		return switch (configuration.getSecretsManagerType()) {
			case MOCK -> new MockSecretsManager();
			case REAL ->
					throw new UnsupportedOperationException(format("No real %s implementation is available yet", SecretsManager.class.getSimpleName()));
		};
	}

	@NonNull
	@Provides
	@Singleton
	public EmailDispatcher provideEmailDispatcher(@NonNull Configuration configuration,
																								@NonNull SecretsManager secretsManager) {
		requireNonNull(configuration);
		requireNonNull(secretsManager);

		return switch (configuration.getEmailDispatcherType()) {
			case MOCK -> new MockEmailDispatcher(configuration);
			case SMTP -> new SmtpEmailDispatcher(configuration, secretsManager);
		};
	}
}
