/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.kubeauth.common.util;

import java.io.IOException;
import java.io.StringReader;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

/**
 * Helpers to read public keys and certificates from PEM text.
 */
public final class PemUtils {

    private PemUtils() {
    }

    /**
     * Parses every public key of a PEM document. {@code PUBLIC KEY}, {@code RSA PUBLIC KEY} and
     * {@code CERTIFICATE} blocks are accepted; the key of a certificate is its subject public key.
     *
     * @throws IOException if the text holds no key, or a block that is not a public key
     */
    public static List<PublicKey> parsePublicKeys(String pem) throws IOException {
        if (StringUtils.isBlank(pem)) {
            throw new IOException("data does not contain any valid RSA or ECDSA public keys");
        }
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        List<PublicKey> keys = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof SubjectPublicKeyInfo) {
                    keys.add(converter.getPublicKey((SubjectPublicKeyInfo) object));
                } else if (object instanceof X509CertificateHolder) {
                    keys.add(converter.getPublicKey(((X509CertificateHolder) object).getSubjectPublicKeyInfo()));
                } else {
                    throw new IOException("Unsupported PEM object " + object.getClass().getSimpleName());
                }
            }
        }
        if (keys.isEmpty()) {
            throw new IOException("data does not contain any valid RSA or ECDSA public keys");
        }
        for (PublicKey key : keys) {
            if (!"RSA".equals(key.getAlgorithm()) && !"EC".equals(key.getAlgorithm())) {
                throw new IOException("Unsupported public key algorithm " + key.getAlgorithm());
            }
        }
        return keys;
    }

    /**
     * Parses every {@code CERTIFICATE} block of a PEM document.
     *
     * @throws IOException if the text holds no certificate or anything else than certificates
     */
    public static List<X509Certificate> parseCertificates(String pem) throws IOException {
        if (StringUtils.isBlank(pem)) {
            throw new IOException("no certificate found");
        }
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
        List<X509Certificate> certificates = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (!(object instanceof X509CertificateHolder)) {
                    throw new IOException("Unsupported PEM object " + object.getClass().getSimpleName());
                }
                certificates.add(converter.getCertificate((X509CertificateHolder) object));
            }
        } catch (CertificateException e) {
            throw new IOException("Invalid certificate: " + e.getMessage(), e);
        }
        if (certificates.isEmpty()) {
            throw new IOException("no certificate found");
        }
        return certificates;
    }
}
