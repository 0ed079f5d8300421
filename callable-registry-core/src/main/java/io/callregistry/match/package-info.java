/**
 * Applicability and specificity scoring of signatures against call arguments.
 *
 * @see io.callregistry.match.SignatureMatcher
 * @see io.callregistry.match.Specificity
 */
package io.callregistry.match;
