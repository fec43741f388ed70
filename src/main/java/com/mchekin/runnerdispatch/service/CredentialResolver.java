package com.mchekin.runnerdispatch.service;

import com.mchekin.runnerdispatch.config.RunnerProperties;
import com.mchekin.runnerdispatch.domain.Installation;
import com.mchekin.runnerdispatch.dto.Credential;
import com.mchekin.runnerdispatch.github.AccessToken;
import com.mchekin.runnerdispatch.github.GitHubClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Produces a bearer credential for an account, preferring an installation token over the
 * statically configured fallback token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialResolver {

    private final InstallationDirectory installationDirectory;
    private final AppJwtSigner appJwtSigner;
    private final GitHubClient gitHubClient;
    private final RunnerProperties properties;

    /**
     * @throws NoCredentialException when neither an active installation nor a fallback token exists
     * @throws com.mchekin.runnerdispatch.github.GitHubApiException when the token exchange fails
     */
    public Credential resolve(String accountLogin) {
        Optional<Installation> installation = installationDirectory.findByAccountLogin(accountLogin);

        if (installation.isPresent() && !installation.get().isSuspended() && appJwtSigner.configured()) {
            Long installationId = installation.get().getInstallationId();
            AccessToken token = gitHubClient.createInstallationToken(appJwtSigner.mint(), installationId);
            log.info("Resolved installation credential: account={}, installationId={}", accountLogin, installationId);
            return new Credential(token.token(), Credential.Source.INSTALLATION, token.expiresAt());
        }

        if (installation.isPresent()) {
            log.warn("Installation not usable, falling back: account={}, suspended={}, appConfigured={}",
                    accountLogin, installation.get().isSuspended(), appJwtSigner.configured());
        }

        String fallbackToken = properties.github().fallbackToken();
        if (fallbackToken != null && !fallbackToken.isBlank()) {
            log.info("Resolved fallback credential: account={}", accountLogin);
            return new Credential(fallbackToken, Credential.Source.FALLBACK, null);
        }

        throw new NoCredentialException(accountLogin);
    }
}
