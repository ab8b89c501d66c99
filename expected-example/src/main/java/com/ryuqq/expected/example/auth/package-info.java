/**
 * Login flow: forwards transport errors into {@code LoginError}.
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.example.auth;
