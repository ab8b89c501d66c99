/**
 * Profile editing flow: forwards transport errors into {Unauthorized, InvalidFormField}.
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.example.profile;
