/**
 * Reusable fixtures for testing workflow primitives.
 *
 * <p>{@link com.ryuqq.workflow.testkit.contract.AbstractPrimitiveContractTest} is the base class
 * of the contract suites; {@link com.ryuqq.workflow.testkit.contract.MockPrimitive} and
 * {@link com.ryuqq.workflow.testkit.contract.MutableClock} can be used from any test that
 * composes primitives.</p>
 */
package com.ryuqq.workflow.testkit.contract;
