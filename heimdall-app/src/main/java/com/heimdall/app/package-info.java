/**
 * Command-line entry point ({@link com.heimdall.app.HeimdallApplication}) and Logback wiring.
 */
package com.heimdall.app;
