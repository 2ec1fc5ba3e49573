/**
 * Public API for FastLog.
 *
 * <p>This package contains the interfaces and classes that applications
 * use directly. Everything under {@code core.internal} may change without notice.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.fastlog.api.FastLog} - Process-wide default logger</li>
 *   <li>{@link io.github.hongjungwan.fastlog.api.FileLoggers} - Creates file/stdout loggers</li>
 *   <li>{@link io.github.hongjungwan.fastlog.api.config.FileLoggerConfig} - Logger configuration</li>
 *   <li>{@link io.github.hongjungwan.fastlog.api.config.FileLoggerConfigs} - JSON configuration loader</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * FileLogger logger = FileLoggers.create(FileLoggerConfig.builder()
 *         .file("logs/payroll.log")
 *         .level(Level.INFO)
 *         .rotateBytes(100L * 1024 * 1024)
 *         .build());
 *
 * logger.info("payroll %s processed in %dms", batchId, elapsed);
 * logger.close();
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.fastlog.api;
