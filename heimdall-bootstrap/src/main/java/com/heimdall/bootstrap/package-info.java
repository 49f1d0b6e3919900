/**
 * Orchestrator: composition root and process-wide facade over configuration, event bus, async executor and
 * plugins, plus the startup and shutdown reports.
 */
package com.heimdall.bootstrap;
