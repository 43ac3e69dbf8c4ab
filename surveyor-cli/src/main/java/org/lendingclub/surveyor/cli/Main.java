/**
 * Copyright 2017-2018 LendingClub, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lendingclub.surveyor.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.lendingclub.surveyor.aws.AWSScannerBuilder;
import org.lendingclub.surveyor.aws.AllServicesScannerGroup;
import org.lendingclub.surveyor.aws.AwsCloudProvider;
import org.lendingclub.surveyor.core.CloudProvider;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.core.ResourceStream;
import org.lendingclub.surveyor.core.ScanCancelledException;
import org.lendingclub.surveyor.core.ScanDiagnostics;
import org.lendingclub.surveyor.core.ScanListener;
import org.lendingclub.surveyor.core.ScanOrchestrator;
import org.lendingclub.surveyor.core.ScannerConfig;
import org.lendingclub.surveyor.core.ScannerConfigLoader;
import org.lendingclub.surveyor.core.ServiceRegistry;
import org.lendingclub.surveyor.report.InventorySummary;
import org.lendingclub.surveyor.report.MarkdownReportWriter;
import org.lendingclub.surveyor.report.ReportFormat;
import org.lendingclub.surveyor.report.ReportWriter;
import org.lendingclub.surveyor.report.SummaryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.STSAssumeRoleSessionCredentialsProvider;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.AWSSecurityTokenServiceClientBuilder;
import com.google.common.base.CharMatcher;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;

public class Main {

	public static final int EXIT_OK = 0;
	public static final int EXIT_ERROR = 1;
	public static final int EXIT_INTERRUPTED = 130;

	static final String REPORT_BASE_NAME = "aws-resources-report";

	static final long SHUTDOWN_WAIT_SECONDS = 10;

	static final String TEXT_LOG_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

	// characters STS allows in a role session name
	static final CharMatcher SESSION_NAME_CHARS = CharMatcher.anyOf("+=,.@-_").or(CharMatcher.inRange('a', 'z'))
			.or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.inRange('0', '9'));

	Logger logger = LoggerFactory.getLogger(Main.class);

	private CloudProvider cloudProvider;
	private Map<String, String> environment = System.getenv();
	private PrintStream out = System.out;
	private volatile ResourceStream running;
	private volatile CountDownLatch finished = new CountDownLatch(0);

	public static void main(String[] args) {
		SLF4JBridgeHandler.removeHandlersForRootLogger();
		SLF4JBridgeHandler.install();

		Main main = new Main();
		Runtime.getRuntime().addShutdownHook(new Thread(main::cancel, "surveyor-shutdown"));
		System.exit(main.run(args));
	}

	/**
	 * Scans through the given provider instead of AWS.
	 */
	public Main withCloudProvider(CloudProvider cloudProvider) {
		this.cloudProvider = cloudProvider;
		return this;
	}

	public Main withEnvironment(Map<String, String> environment) {
		this.environment = environment;
		return this;
	}

	public Main withOutput(PrintStream out) {
		this.out = out;
		return this;
	}

	/**
	 * Closes the scan in progress, if any, and waits briefly for the run to report
	 * what it has.
	 */
	public void cancel() {
		ResourceStream stream = running;
		if (stream != null && !stream.isClosed()) {
			logger.warn("scan interrupted, shutting down");
			stream.close();
			try {
				if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
					logger.warn("scan did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}

	public int run(String... args) {
		finished = new CountDownLatch(1);
		try {
			return doRun(args);
		} finally {
			finished.countDown();
		}
	}

	int doRun(String... args) {
		CommandLineOptions options;
		try {
			options = CommandLineOptions.parse(args);
		} catch (IllegalArgumentException e) {
			out.println(e.getMessage());
			out.println(CommandLineOptions.USAGE);
			return EXIT_ERROR;
		}
		if (options.isHelp()) {
			out.println(CommandLineOptions.USAGE);
			return EXIT_OK;
		}

		Path reportPath = null;
		try {
			ScannerConfig config = loadConfig(options);
			setLogLevel(config.getLogLevel());
			setLogFormat(config.getLogFormat());
			ReportFormat format = ReportFormat.parse(config.getReportFormat());
			reportPath = reportPath(options, config, format);

			CloudProvider provider = cloudProvider != null ? cloudProvider : newAwsProvider(options);
			ServiceRegistry registry = new AllServicesScannerGroup(
					new AWSScannerBuilder().withCloudProvider(provider).withConfig(config)).buildRegistry();
			ScanListener listener = options.isNoProgress() ? ScanListener.NONE : new ProgressListener();
			ScanOrchestrator orchestrator = ScanOrchestrator.builder().withConfig(config).withRegistry(registry)
					.withCloudProvider(provider).withListener(listener).build();

			Stopwatch sw = Stopwatch.createStarted();
			InventorySummary summary = options.isStreaming() ? scanStreaming(orchestrator, format, reportPath)
					: scanEager(orchestrator, format, reportPath);
			out.println();
			out.println("Scan completed in " + sw);
			new SummaryTable().print(summary, out);
			out.println("Report saved to: " + reportPath);
			logErrors(orchestrator.getDiagnostics());
			return EXIT_OK;
		} catch (ScanCancelledException e) {
			out.println("Scan interrupted by user");
			if (options.isStreaming() && reportPath != null && Files.exists(reportPath)) {
				out.println("Partial report saved to: " + reportPath);
			}
			return EXIT_INTERRUPTED;
		} catch (IOException e) {
			out.println("Error saving report: " + e.getMessage());
			logger.error("unable to write report", e);
			return EXIT_ERROR;
		} catch (RuntimeException e) {
			out.println("Error: " + e.getMessage());
			logger.error("scan failed", e);
			return EXIT_ERROR;
		}
	}

	InventorySummary scanEager(ScanOrchestrator orchestrator, ReportFormat format, Path reportPath)
			throws IOException {
		List<Resource> resources = Lists.newArrayList();
		try (ResourceStream stream = orchestrator.stream()) {
			running = stream;
			stream.forEachRemaining(resources::add);
			if (stream.isCancelled()) {
				throw new ScanCancelledException("scan closed before all services completed");
			}
		} finally {
			running = null;
		}
		ReportWriter writer = newWriter(format, orchestrator.getDiagnostics());
		try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
			writer.write(resources, w);
		}
		return InventorySummary.of(resources);
	}

	InventorySummary scanStreaming(ScanOrchestrator orchestrator, ReportFormat format, Path reportPath)
			throws IOException {
		try (ResourceStream stream = orchestrator.stream();
				Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
			running = stream;
			InventorySummary summary = newWriter(format, stream.getDiagnostics()).writeStreaming(stream, w);
			if (stream.isCancelled()) {
				throw new ScanCancelledException("scan closed before all services completed");
			}
			return summary;
		} finally {
			running = null;
		}
	}

	ReportWriter newWriter(ReportFormat format, ScanDiagnostics diagnostics) {
		ReportWriter writer = format.newWriter();
		if (writer instanceof MarkdownReportWriter) {
			((MarkdownReportWriter) writer).withDiagnostics(diagnostics);
		}
		return writer;
	}

	ScannerConfig loadConfig(CommandLineOptions options) {
		ScannerConfigLoader loader = new ScannerConfigLoader().withEnvironment(environment);
		String path = options.getConfig().orElse(environment.get(ScannerConfigLoader.CONFIG_ENV));
		if (Strings.isNullOrEmpty(path)) {
			path = ScannerConfigLoader.DEFAULT_CONFIG_FILE;
		}
		ScannerConfig.Builder b = loader.loadBuilder(new File(path));
		return options.applyTo(b).build();
	}

	/**
	 * The configured path, except that the default markdown path takes the
	 * extension of another format.
	 */
	static Path reportPath(CommandLineOptions options, ScannerConfig config, ReportFormat format) {
		String path = config.getReportPath();
		if (!options.getOutput().isPresent() && path.equals(ScannerConfig.DEFAULT_REPORT_PATH)) {
			path = REPORT_BASE_NAME + "." + format.getExtension();
		}
		return Paths.get(path);
	}

	AWSCredentialsProvider newCredentialsProvider(CommandLineOptions options) {
		AWSCredentialsProvider credentialsProvider = new DefaultAWSCredentialsProviderChain();
		if (options.getRole().isPresent()) {
			String sessionName = "surveyor-"
					+ SESSION_NAME_CHARS.retainFrom(Strings.nullToEmpty(System.getProperty("user.name")));
			AWSSecurityTokenService sts = AWSSecurityTokenServiceClientBuilder.standard().build();
			credentialsProvider = new STSAssumeRoleSessionCredentialsProvider.Builder(options.getRole().get(),
					sessionName).withStsClient(sts).build();
			logger.info("assuming role {}", options.getRole().get());
		}
		return credentialsProvider;
	}

	CloudProvider newAwsProvider(CommandLineOptions options) {
		return new AwsCloudProvider().withCredentials(newCredentialsProvider(options));
	}

	void logErrors(ScanDiagnostics diagnostics) {
		if (diagnostics == null) {
			return;
		}
		diagnostics.getServicesWithErrors().forEach(service -> {
			service.getFailedRegions().forEach((region, kind) -> logger.warn("{} in {}: {} ({})",
					service.getService(), region, kind, service.getFailureMessage(region).orElse("")));
			service.getServiceError().ifPresent(e -> logger.warn("{} failed: {}", service.getService(), e.toString()));
		});
	}

	/**
	 * Applies the level to the logback root logger. <code>WARNING</code> is
	 * accepted for <code>WARN</code>.
	 */
	static void setLogLevel(String level) {
		Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
		if (root instanceof ch.qos.logback.classic.Logger) {
			String name = Strings.nullToEmpty(level).trim();
			if (name.equalsIgnoreCase("WARNING")) {
				name = "WARN";
			}
			((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(name, Level.INFO));
		}
	}

	/**
	 * Switches the encoder of every appender on the root logger, to one JSON
	 * object per line for <code>json</code> or back to the plain pattern.
	 */
	static void setLogFormat(String format) {
		if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
			return;
		}
		LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
		boolean json = ScannerConfig.LOG_FORMAT_JSON.equals(format);
		Iterator<Appender<ILoggingEvent>> it = context.getLogger(Logger.ROOT_LOGGER_NAME).iteratorForAppenders();
		while (it.hasNext()) {
			Appender<ILoggingEvent> appender = it.next();
			if (!(appender instanceof OutputStreamAppender)) {
				continue;
			}
			OutputStreamAppender<ILoggingEvent> out = (OutputStreamAppender<ILoggingEvent>) appender;
			if (json == JsonLogLayout.isJson(out.getEncoder())) {
				continue;
			}
			Encoder<ILoggingEvent> encoder;
			if (json) {
				JsonLogLayout layout = new JsonLogLayout();
				layout.setContext(context);
				layout.start();
				LayoutWrappingEncoder<ILoggingEvent> wrapper = new LayoutWrappingEncoder<>();
				wrapper.setLayout(layout);
				encoder = wrapper;
			} else {
				PatternLayoutEncoder pattern = new PatternLayoutEncoder();
				pattern.setPattern(TEXT_LOG_PATTERN);
				encoder = pattern;
			}
			encoder.setContext(context);
			encoder.start();
			out.stop();
			out.setEncoder(encoder);
			out.start();
		}
	}
}
