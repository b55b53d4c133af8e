/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.satupscale.exception.SatUpscaleException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.satupscale.exception.InputNotFoundException} - An input file
 *       selected for upscaling is missing</li>
 *   <li>{@link com.phillippitts.satupscale.exception.JobCancelledException} - A queued job was
 *       cancelled at a unit boundary</li>
 *   <li>{@link com.phillippitts.satupscale.exception.RunCancelledException} - An upscale batch
 *       was cancelled; its outputs have been removed</li>
 *   <li>{@link com.phillippitts.satupscale.exception.JobFailedException} - A unit of work raised
 *       a checked exception</li>
 *   <li>{@link com.phillippitts.satupscale.exception.UpscaleFailedException} - Every strategy of a
 *       fallback chain failed</li>
 *   <li>{@link com.phillippitts.satupscale.exception.ModelInvocationException} - The external
 *       model process failed</li>
 * </ul>
 *
 * <p>Precondition violations (non-positive scale or unit count) use
 * {@link java.lang.IllegalArgumentException}; queue misuse uses
 * {@link java.lang.IllegalStateException}. Both map to HTTP responses via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.satupscale.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.satupscale.exception;
