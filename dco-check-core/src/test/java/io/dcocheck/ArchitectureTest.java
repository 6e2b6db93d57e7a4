package io.dcocheck;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link DcoClient} - GitHub operations needed by the DCO check</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link GitHubHttpClient} - Default HTTP implementation</li>
 * <li>{@link RetryingGitHubClient} - Retry decorator with exponential backoff</li>
 * <li>{@link GitHubDcoClient} - REST API implementation of DcoClient</li>
 * <li>{@link CachingDcoClient} - Membership cache decorator</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   EventProcessor → DcoClient (NOT concrete implementations)
 *   Check engine → commits and configuration only (no I/O)
 *   Decorators → Interface they decorate
 * </pre>
 */
@AnalyzeClasses(packages = "io.dcocheck", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule event_processor_should_depend_on_client_interface = noClasses().that()
		.haveSimpleName("EventProcessor")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubDcoClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("CachingDcoClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("EventProcessor should depend on the DcoClient interface, not concrete clients");

	// ========== Check Engine Rules ==========

	@ArchTest
	static final ArchRule check_engine_should_not_depend_on_clients = noClasses().that()
		.haveSimpleName("DcoCheckEngine")
		.or()
		.haveSimpleNameEndingWith("Extractor")
		.or()
		.haveSimpleNameEndingWith("Matcher")
		.or()
		.haveSimpleNameEndingWith("Collector")
		.or()
		.haveSimpleNameEndingWith("Classifier")
		.or()
		.haveSimpleNameEndingWith("Validator")
		.or()
		.haveSimpleName("CheckSummaryRenderer")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.because("The check engine is a pure function of commits and configuration");

	@ArchTest
	static final ArchRule check_engine_should_not_access_network = noClasses().that()
		.haveSimpleName("DcoCheckEngine")
		.or()
		.haveSimpleName("CheckSummaryRenderer")
		.should()
		.accessClassesThat()
		.resideInAPackage("java.net.http..")
		.because("The check engine performs no I/O");

	@ArchTest
	static final ArchRule models_should_not_depend_on_processing = noClasses().that()
		.haveSimpleName("Commit")
		.or()
		.haveSimpleName("GitUser")
		.or()
		.haveSimpleNameEndingWith("Output")
		.or()
		.haveSimpleNameEndingWith("Event")
		.or()
		.haveSimpleNameEndingWith("Config")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("EventProcessor")
		.because("Model classes should be pure data without service dependencies");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule dco_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("DcoClient")
		.and()
		.doNotHaveSimpleName("DcoClient")
		.should()
		.implement(DcoClient.class)
		.because("All *DcoClient classes should implement the DcoClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	@ArchTest
	static final ArchRule caching_client_should_not_depend_on_concrete_client = noClasses().that()
		.haveSimpleName("CachingDcoClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubDcoClient")
		.because("Decorators should depend on the DcoClient interface, not concrete implementation");

	// ========== Builder/Configuration Rules ==========

	@ArchTest
	static final ArchRule only_builder_should_instantiate_concrete_implementations = noClasses().that()
		.doNotHaveSimpleName("DcoCheckBuilder")
		.and()
		.doNotHaveSimpleName("GitHubDcoClient")
		.and()
		.doNotHaveSimpleName("GitHubAppTokenProvider")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubDcoClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubAppTokenProvider")
		.because("Only DcoCheckBuilder should create concrete implementations");

}
