/**
 * NoOp SPI implementations, used as defaults when no observer is configured.
 */
package com.ryuqq.workflow.core.spi.noop;
